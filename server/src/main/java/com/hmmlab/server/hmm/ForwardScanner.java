package com.hmmlab.server.hmm;

public class ForwardScanner {

    private final double epsilon;

    public ForwardScanner(double epsilon) {
        this.epsilon = epsilon;
    }

    /**
     * Scaled forward pass. Each alpha[t] is rescaled to sum to one and the factor
     * c[t] = 1 / (sum + epsilon) is kept for the backward pass. A time step with
     * zero total probability leaves alpha[t] at zero and c[t] at 1 / epsilon.
     */
    public ForwardResult scan(HmmModel model, int[] obs) {
        int T = obs.length;
        if (T == 0) {
            throw new HmmValidationException("Cannot scan a sequence of length 0");
        }
        int n = model.getNumStates();
        double[][] a = model.getTransitions();
        double[][] b = model.getEmissions();
        double[] pi = model.getInitial();

        double[][] alpha = new double[T][n];
        double[] c = new double[T];

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            alpha[0][i] = pi[i] * b[i][obs[0]];
            sum += alpha[0][i];
        }
        c[0] = 1.0 / (sum + epsilon);
        for (int i = 0; i < n; i++) {
            alpha[0][i] *= c[0];
        }

        for (int t = 1; t < T; t++) {
            sum = 0.0;
            for (int j = 0; j < n; j++) {
                double acc = 0.0;
                for (int i = 0; i < n; i++) {
                    acc += alpha[t - 1][i] * a[i][j];
                }
                alpha[t][j] = acc * b[j][obs[t]];
                sum += alpha[t][j];
            }
            c[t] = 1.0 / (sum + epsilon);
            for (int j = 0; j < n; j++) {
                alpha[t][j] *= c[t];
            }
        }
        return new ForwardResult(alpha, c);
    }

    /**
     * Total log-likelihood of every sequence in the set under the model.
     */
    public double logLikelihood(HmmModel model, TrainingSet set) {
        double total = 0.0;
        for (int[] seq : set.getSequences()) {
            total += scan(model, seq).logLikelihood();
        }
        return total;
    }
}
