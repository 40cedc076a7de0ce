package com.hmmlab.server.hmm;

/**
 * Turns forward/backward results into state (gamma) and transition (xi)
 * posteriors and folds them into {@link SufficientStatistics}.
 */
public class PosteriorAggregator {

    private final double epsilon;

    public PosteriorAggregator(double epsilon) {
        this.epsilon = epsilon;
    }

    /**
     * gamma[t][i] proportional to alpha[t][i] * beta[t][i], renormalized per time step.
     */
    public double[][] stateOccupancy(double[][] alpha, double[][] beta) {
        int T = alpha.length;
        int n = T > 0 ? alpha[0].length : 0;
        double[][] gamma = new double[T][n];
        for (int t = 0; t < T; t++) {
            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                gamma[t][i] = alpha[t][i] * beta[t][i];
                sum += gamma[t][i];
            }
            double norm = sum + epsilon;
            for (int i = 0; i < n; i++) {
                gamma[t][i] /= norm;
            }
        }
        return gamma;
    }

    /**
     * xi[i][j] for the transition from step t to t+1, renormalized to sum to one.
     * Written into the supplied buffer.
     */
    public void transitionOccupancy(HmmModel model, int[] obs, int t, double[][] alpha, double[][] beta,
            double[][] xi) {
        int n = model.getNumStates();
        double[][] a = model.getTransitions();
        double[][] b = model.getEmissions();
        int next = obs[t + 1];

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                xi[i][j] = alpha[t][i] * a[i][j] * b[j][next] * beta[t + 1][j];
                sum += xi[i][j];
            }
        }
        double norm = sum + epsilon;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                xi[i][j] /= norm;
            }
        }
    }

    /**
     * Adds one sequence's posteriors to the statistics. Per-sequence sums over t are
     * formed first and then added, so a T = 1 sequence contributes only to Pi and B.
     */
    public void accumulate(HmmModel model, int[] obs, ForwardResult forward, double[][] beta,
            SufficientStatistics stats) {
        int T = obs.length;
        int n = model.getNumStates();
        int m = model.getNumSymbols();
        double[][] alpha = forward.getAlpha();
        double[][] gamma = stateOccupancy(alpha, beta);

        double[][] xiSum = new double[n][n];
        double[][] xi = new double[n][n];
        for (int t = 0; t < T - 1; t++) {
            transitionOccupancy(model, obs, t, alpha, beta, xi);
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    xiSum[i][j] += xi[i][j];
                }
            }
        }

        for (int i = 0; i < n; i++) {
            stats.initialCounts[i] += gamma[0][i];
            for (int j = 0; j < n; j++) {
                stats.transitionCounts[i][j] += xiSum[i][j];
            }

            double nonFinal = 0.0;
            for (int t = 0; t < T - 1; t++) {
                nonFinal += gamma[t][i];
            }
            stats.transitionOccupancy[i] += nonFinal;

            double[] bySymbol = new double[m];
            double all = 0.0;
            for (int t = 0; t < T; t++) {
                bySymbol[obs[t]] += gamma[t][i];
                all += gamma[t][i];
            }
            for (int k = 0; k < m; k++) {
                stats.emissionCounts[i][k] += bySymbol[k];
            }
            stats.emissionOccupancy[i] += all;
        }
        stats.addSequence(forward.logLikelihood());
    }
}
