package com.hmmlab.server.hmm;

import java.util.Collections;
import java.util.List;

public class TrainingResult {
    private final HmmModel model;
    private final List<Double> logLikelihoodHistory;
    private final double finalLogLikelihood;
    private final int iterations;
    private final TrainingState state;

    public TrainingResult(HmmModel model, List<Double> logLikelihoodHistory, double finalLogLikelihood,
            int iterations, TrainingState state) {
        this.model = model;
        this.logLikelihoodHistory = Collections.unmodifiableList(logLikelihoodHistory);
        this.finalLogLikelihood = finalLogLikelihood;
        this.iterations = iterations;
        this.state = state;
    }

    public HmmModel getModel() {
        return model;
    }

    /**
     * Entry k is the log-likelihood of the model going into iteration k.
     */
    public List<Double> getLogLikelihoodHistory() {
        return logLikelihoodHistory;
    }

    /**
     * Log-likelihood of the returned model over the training set.
     */
    public double getFinalLogLikelihood() {
        return finalLogLikelihood;
    }

    public int getIterations() {
        return iterations;
    }

    public TrainingState getState() {
        return state;
    }

    @Override
    public String toString() {
        return "TrainingResult{" +
                "iterations=" + iterations +
                ", state=" + state +
                ", finalLogLikelihood=" + String.format("%.6f", finalLogLikelihood) +
                '}';
    }
}
