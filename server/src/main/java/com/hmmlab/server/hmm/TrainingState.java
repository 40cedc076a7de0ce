package com.hmmlab.server.hmm;

public enum TrainingState {
    INITIALIZED,
    ITERATING,
    CONVERGED,
    BUDGET_EXHAUSTED
}
