package com.hmmlab.server.hmm;

import com.hmmlab.server.hmm.inference.MathUtil;

/**
 * Discrete HMM parameters: N states, M symbols, transition matrix A (N x N),
 * emission matrix B (N x M) and initial distribution Pi (N).
 * <p>
 * Arrays are held by reference; {@link ReEstimator} overwrites them in place
 * once per training iteration. Everything else only reads them.
 */
public class HmmModel {
    private final int numStates;
    private final int numSymbols;
    private final double[][] transitions;
    private final double[][] emissions;
    private final double[] initial;

    public HmmModel(double[][] transitions, double[][] emissions, double[] initial) {
        if (transitions == null || emissions == null || initial == null) {
            throw new HmmValidationException("A, B and Pi must all be provided");
        }
        int n = transitions.length;
        if (n < 1) {
            throw new HmmValidationException("State count N must be >= 1, got " + n);
        }
        if (emissions.length != n) {
            throw new HmmValidationException("B must have N=" + n + " rows, got " + emissions.length);
        }
        if (initial.length != n) {
            throw new HmmValidationException("Pi must have N=" + n + " entries, got " + initial.length);
        }
        if (emissions[0] == null || emissions[0].length < 1) {
            throw new HmmValidationException("Symbol count M must be >= 1");
        }
        int m = emissions[0].length;
        for (int i = 0; i < n; i++) {
            checkRow("A", i, transitions[i], n);
            checkRow("B", i, emissions[i], m);
        }
        checkRow("Pi", 0, initial, n);

        this.numStates = n;
        this.numSymbols = m;
        this.transitions = transitions;
        this.emissions = emissions;
        this.initial = initial;
    }

    private static void checkRow(String name, int row, double[] values, int expectedLength) {
        if (values == null || values.length != expectedLength) {
            throw new HmmValidationException(name + " row " + row + " must have " + expectedLength + " entries, got "
                    + (values == null ? 0 : values.length));
        }
        for (int j = 0; j < values.length; j++) {
            double v = values[j];
            if (Double.isNaN(v) || Double.isInfinite(v) || v < 0.0) {
                throw new HmmValidationException(
                        name + "[" + row + "][" + j + "] must be a finite non-negative number, got " + v);
            }
        }
    }

    public int getNumStates() {
        return numStates;
    }

    public int getNumSymbols() {
        return numSymbols;
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

    /**
     * True when every row of A and B, and Pi, sums to one within the tolerance.
     */
    public boolean isStochastic(double tolerance) {
        for (int i = 0; i < numStates; i++) {
            if (!MathUtil.sumsToOne(transitions[i], tolerance) || !MathUtil.sumsToOne(emissions[i], tolerance)) {
                return false;
            }
        }
        return MathUtil.sumsToOne(initial, tolerance);
    }

    public HmmModel copy() {
        return new HmmModel(MathUtil.copy(transitions), MathUtil.copy(emissions), initial.clone());
    }
}
