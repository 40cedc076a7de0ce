package com.hmmlab.server.hmm;

import com.hmmlab.server.hmm.inference.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * M-step: overwrites A, B and Pi from the accumulated statistics.
 * <p>
 * A row whose occupancy denominator is at or below {@code minOccupancy} belongs to
 * a state the data never visited; that row keeps its previous value. Any updated
 * row whose sum drifts past {@code rowSumTolerance} is renormalized. Non-finite
 * statistics are rejected before anything is written.
 */
public class ReEstimator {
    private static final Logger logger = LoggerFactory.getLogger(ReEstimator.class);

    private final double epsilon;
    private final double minOccupancy;
    private final double rowSumTolerance;

    public ReEstimator(double epsilon, double minOccupancy, double rowSumTolerance) {
        this.epsilon = epsilon;
        this.minOccupancy = minOccupancy;
        this.rowSumTolerance = rowSumTolerance;
    }

    public ReEstimator(TrainingConfig config) {
        this(config.epsilon, config.minOccupancy, config.rowSumTolerance);
    }

    public void update(HmmModel model, SufficientStatistics stats) {
        int n = model.getNumStates();
        int m = model.getNumSymbols();
        int k = stats.getSequenceCount();
        if (k < 1) {
            throw new IllegalStateException("No sequences were accumulated");
        }
        for (int i = 0; i < n; i++) {
            requireFinite("transition occupancy", i, stats.transitionOccupancy[i]);
            requireFinite("emission occupancy", i, stats.emissionOccupancy[i]);
        }
        double[][] a = model.getTransitions();
        double[][] b = model.getEmissions();
        double[] pi = model.getInitial();

        double[] nextPi = new double[n];
        for (int i = 0; i < n; i++) {
            nextPi[i] = stats.initialCounts[i] / k;
        }
        double piMass = requireFinite("initial-state posterior mass", -1, MathUtil.sum(nextPi));
        if (piMass > minOccupancy) {
            System.arraycopy(nextPi, 0, pi, 0, n);
            enforceStochastic("Pi", 0, pi);
        } else {
            logger.warn("Initial-state posteriors vanished; keeping previous Pi");
        }

        for (int i = 0; i < n; i++) {
            double denomA = stats.transitionOccupancy[i];
            if (denomA > minOccupancy) {
                for (int j = 0; j < n; j++) {
                    a[i][j] = stats.transitionCounts[i][j] / (denomA + epsilon);
                }
                enforceStochastic("A", i, a[i]);
            } else {
                logger.warn("State {} has transition occupancy {}; keeping previous A row", i, denomA);
            }

            double denomB = stats.emissionOccupancy[i];
            if (denomB > minOccupancy) {
                for (int s = 0; s < m; s++) {
                    b[i][s] = stats.emissionCounts[i][s] / (denomB + epsilon);
                }
                enforceStochastic("B", i, b[i]);
            } else {
                logger.warn("State {} has emission occupancy {}; keeping previous B row", i, denomB);
            }

            if (logger.isTraceEnabled()) {
                logger.trace("Re-estimated state {}: A={}, B={}", i, Arrays.toString(a[i]), Arrays.toString(b[i]));
            }
        }
    }

    // NaN compares false against minOccupancy and would read as an unvisited state.
    private static double requireFinite(String name, int state, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalStateException(
                    (state >= 0 ? "State " + state + " " : "") + name + " is not finite: " + value);
        }
        return value;
    }

    private void enforceStochastic(String name, int row, double[] values) {
        double sum = MathUtil.sum(values);
        if (Math.abs(sum - 1.0) > rowSumTolerance && sum > 0.0) {
            logger.trace("{} row {} sums to {}; renormalizing", name, row, sum);
            MathUtil.normalizeInPlace(values);
        }
    }
}
