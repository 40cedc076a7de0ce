package com.hmmlab.server.hmm.inference;

public class DecodingResult {
    private final int[] path;
    private final double logProbability;

    public DecodingResult(int[] path, double logProbability) {
        this.path = path;
        this.logProbability = logProbability;
    }

    public int[] getPath() {
        return path;
    }

    public double getLogProbability() {
        return logProbability;
    }
}
