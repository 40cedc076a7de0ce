package com.hmmlab.server.hmm;

/**
 * Expected counts gathered in the E-step. One record per sequence is filled by
 * {@link PosteriorAggregator}; records are then merged in sequence order so the
 * summation order never depends on how the sequences were scheduled.
 */
public class SufficientStatistics {
    // [i][j] sum over t < T-1 of xi[t][i][j]
    final double[][] transitionCounts;
    // [i] sum over t < T-1 of gamma[t][i], denominator for A
    final double[] transitionOccupancy;
    // [i][k] sum over t with obs[t] == k of gamma[t][i]
    final double[][] emissionCounts;
    // [i] sum over all t of gamma[t][i], denominator for B
    final double[] emissionOccupancy;
    // [i] sum over sequences of gamma[0][i]
    final double[] initialCounts;
    private int sequenceCount;
    private double logLikelihood;

    public SufficientStatistics(int numStates, int numSymbols) {
        this.transitionCounts = new double[numStates][numStates];
        this.transitionOccupancy = new double[numStates];
        this.emissionCounts = new double[numStates][numSymbols];
        this.emissionOccupancy = new double[numStates];
        this.initialCounts = new double[numStates];
    }

    void addSequence(double logLikelihood) {
        this.sequenceCount++;
        this.logLikelihood += logLikelihood;
    }

    public void merge(SufficientStatistics other) {
        int n = initialCounts.length;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                transitionCounts[i][j] += other.transitionCounts[i][j];
            }
            for (int k = 0; k < emissionCounts[i].length; k++) {
                emissionCounts[i][k] += other.emissionCounts[i][k];
            }
            transitionOccupancy[i] += other.transitionOccupancy[i];
            emissionOccupancy[i] += other.emissionOccupancy[i];
            initialCounts[i] += other.initialCounts[i];
        }
        sequenceCount += other.sequenceCount;
        logLikelihood += other.logLikelihood;
    }

    public int getSequenceCount() {
        return sequenceCount;
    }

    public double getLogLikelihood() {
        return logLikelihood;
    }

    public double[][] getTransitionCounts() {
        return transitionCounts;
    }

    public double[] getTransitionOccupancy() {
        return transitionOccupancy;
    }

    public double[][] getEmissionCounts() {
        return emissionCounts;
    }

    public double[] getEmissionOccupancy() {
        return emissionOccupancy;
    }

    public double[] getInitialCounts() {
        return initialCounts;
    }
}
