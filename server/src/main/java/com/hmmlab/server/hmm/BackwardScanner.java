package com.hmmlab.server.hmm;

public class BackwardScanner {

    /**
     * Scaled backward pass. Reuses the forward scaling factors so that alpha and
     * beta share a scale and their products normalize per time step.
     * <p>
     * After a zero-probability step c[t] is 1 / epsilon, so beta grows by that
     * factor per step for the states alpha has already ruled out. Beta is capped at
     * {@link Double#MAX_VALUE} so those states keep a zero posterior (0 * MAX) instead
     * of turning into 0 * Infinity = NaN.
     */
    public double[][] scan(HmmModel model, int[] obs, double[] scale) {
        int T = obs.length;
        if (scale.length != T) {
            throw new IllegalArgumentException(
                    "Scaling factors cover " + scale.length + " steps but sequence has " + T);
        }
        int n = model.getNumStates();
        double[][] a = model.getTransitions();
        double[][] b = model.getEmissions();

        double[][] beta = new double[T][n];
        for (int i = 0; i < n; i++) {
            beta[T - 1][i] = scale[T - 1];
        }
        for (int t = T - 2; t >= 0; t--) {
            int next = obs[t + 1];
            for (int i = 0; i < n; i++) {
                double acc = 0.0;
                for (int j = 0; j < n; j++) {
                    acc += a[i][j] * b[j][next] * beta[t + 1][j];
                }
                beta[t][i] = Math.min(scale[t] * acc, Double.MAX_VALUE);
            }
        }
        return beta;
    }
}
