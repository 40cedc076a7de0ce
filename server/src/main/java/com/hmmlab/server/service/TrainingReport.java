package com.hmmlab.server.service;

import com.hmmlab.server.hmm.TrainingResult;

public class TrainingReport {
    private final TrainingResult result;
    private final double executionTimeSeconds;

    public TrainingReport(TrainingResult result, double executionTimeSeconds) {
        this.result = result;
        this.executionTimeSeconds = executionTimeSeconds;
    }

    public TrainingResult getResult() {
        return result;
    }

    public double getExecutionTimeSeconds() {
        return executionTimeSeconds;
    }
}
