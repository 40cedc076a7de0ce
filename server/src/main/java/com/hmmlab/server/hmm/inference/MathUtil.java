package com.hmmlab.server.hmm.inference;

public class MathUtil {

    public static double sum(double[] x) {
        double s = 0.0;
        for (double v : x) {
            s += v;
        }
        return s;
    }

    /**
     * Divides every entry by the total so the array sums to one.
     *
     * @return the total before normalization
     */
    public static double normalizeInPlace(double[] x) {
        double s = sum(x);
        for (int i = 0; i < x.length; i++) {
            x[i] /= s;
        }
        return s;
    }

    public static boolean sumsToOne(double[] x, double tolerance) {
        return Math.abs(sum(x) - 1.0) <= tolerance;
    }

    /**
     * Natural log of p, with p floored so zero probabilities stay finite.
     */
    public static double flooredLog(double p, double floor) {
        return Math.log(Math.max(p, floor));
    }

    /**
     * Returns the index of the maximum value in the array. Ties go to the lowest index.
     */
    public static int argmax(double[] x) {
        int bestIdx = -1;
        double bestVal = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < x.length; i++) {
            if (x[i] > bestVal) {
                bestVal = x[i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    public static double[][] copy(double[][] x) {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = x[i] == null ? null : x[i].clone();
        }
        return out;
    }
}
