package com.hmmlab.server.service;

/**
 * A, B and Pi as supplied by a caller, before validation.
 */
public class InitialParameters {
    private final double[][] transitions;
    private final double[][] emissions;
    private final double[] initial;

    public InitialParameters(double[][] transitions, double[][] emissions, double[] initial) {
        this.transitions = transitions;
        this.emissions = emissions;
        this.initial = initial;
    }

    public double[][] getTransitions() {
        return transitions;
    }

    public double[][] getEmissions() {
        return emissions;
    }

    public double[] getInitial() {
        return initial;
    }
}
