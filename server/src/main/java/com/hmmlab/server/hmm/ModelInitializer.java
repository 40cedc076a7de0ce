package com.hmmlab.server.hmm;

import com.hmmlab.server.hmm.inference.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Seeds a model before the first iteration, either from a seeded random draw
 * (init mode 0) or from caller-supplied parameters (init mode 1).
 */
public class ModelInitializer {
    private static final Logger logger = LoggerFactory.getLogger(ModelInitializer.class);

    /**
     * Draws A row by row, then B row by row, then Pi, each entry uniform in [0, 1)
     * and each row normalized. The same seed always yields the same model.
     */
    public static HmmModel random(int numStates, int numSymbols, long seed) {
        if (numStates < 1) {
            throw new HmmValidationException("State count N must be >= 1, got " + numStates);
        }
        if (numSymbols < 1) {
            throw new HmmValidationException("Symbol count M must be >= 1, got " + numSymbols);
        }
        Random rnd = new Random(seed);
        double[][] a = new double[numStates][];
        for (int i = 0; i < numStates; i++) {
            a[i] = randomRow(rnd, numStates);
        }
        double[][] b = new double[numStates][];
        for (int i = 0; i < numStates; i++) {
            b[i] = randomRow(rnd, numSymbols);
        }
        double[] pi = randomRow(rnd, numStates);
        logger.debug("Random model drawn: N={}, M={}, seed={}", numStates, numSymbols, seed);
        return new HmmModel(a, b, pi);
    }

    private static double[] randomRow(Random rnd, int length) {
        double[] row = new double[length];
        for (int j = 0; j < length; j++) {
            row[j] = rnd.nextDouble();
        }
        MathUtil.normalizeInPlace(row);
        return row;
    }

    /**
     * Builds a model from caller-supplied A, B and Pi. Shape, finiteness and
     * non-negativity are enforced; a row whose sum misses one by more than the
     * tolerance is renormalized, and an all-zero row is rejected. The input
     * arrays are copied.
     */
    public static HmmModel fromParameters(int numStates, int numSymbols, double[][] a, double[][] b, double[] pi,
            double tolerance) {
        if (numStates < 1) {
            throw new HmmValidationException("State count N must be >= 1, got " + numStates);
        }
        if (numSymbols < 1) {
            throw new HmmValidationException("Symbol count M must be >= 1, got " + numSymbols);
        }
        if (a == null || b == null || pi == null) {
            throw new HmmValidationException("Caller-supplied initialization requires A, B and Pi");
        }
        if (a.length != numStates) {
            throw new HmmValidationException("A must have N=" + numStates + " rows, got " + a.length);
        }
        if (b.length != numStates) {
            throw new HmmValidationException("B must have N=" + numStates + " rows, got " + b.length);
        }
        for (int i = 0; i < numStates; i++) {
            if (b[i] == null || b[i].length != numSymbols) {
                throw new HmmValidationException("B row " + i + " must have M=" + numSymbols + " entries, got "
                        + (b[i] == null ? 0 : b[i].length));
            }
        }
        HmmModel model = new HmmModel(MathUtil.copy(a), MathUtil.copy(b), pi.clone());

        for (int i = 0; i < numStates; i++) {
            normalizeRow("A", i, model.getTransitions()[i], tolerance);
            normalizeRow("B", i, model.getEmissions()[i], tolerance);
        }
        normalizeRow("Pi", 0, model.getInitial(), tolerance);
        return model;
    }

    private static void normalizeRow(String name, int row, double[] values, double tolerance) {
        double sum = MathUtil.sum(values);
        if (sum <= 0.0) {
            throw new HmmValidationException(name + " row " + row + " sums to 0 and cannot be normalized");
        }
        if (Math.abs(sum - 1.0) > tolerance) {
            logger.warn("{} row {} sums to {}; renormalizing caller-supplied values", name, row, sum);
            MathUtil.normalizeInPlace(values);
        }
    }
}
