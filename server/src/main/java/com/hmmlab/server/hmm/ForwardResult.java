package com.hmmlab.server.hmm;

/**
 * Scaled forward probabilities alpha[T][N] and scaling factors c[T] for one sequence.
 */
public class ForwardResult {
    private final double[][] alpha;
    private final double[] scale;

    public ForwardResult(double[][] alpha, double[] scale) {
        this.alpha = alpha;
        this.scale = scale;
    }

    public double[][] getAlpha() {
        return alpha;
    }

    public double[] getScale() {
        return scale;
    }

    public int length() {
        return scale.length;
    }

    /**
     * log P(O | model) recovered from the scaling factors: -sum_t log c[t].
     */
    public double logLikelihood() {
        double logL = 0.0;
        for (double c : scale) {
            logL -= Math.log(c);
        }
        return logL;
    }
}
