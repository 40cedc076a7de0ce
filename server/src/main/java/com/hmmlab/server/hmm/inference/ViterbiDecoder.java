package com.hmmlab.server.hmm.inference;

import com.hmmlab.server.hmm.HmmModel;
import com.hmmlab.server.hmm.HmmValidationException;

/**
 * Most likely hidden-state path in log space. Probabilities are floored before
 * taking logs so zero entries rank last instead of producing -Infinity.
 */
public class ViterbiDecoder {

    public static final double PROBABILITY_FLOOR = 1e-10;

    public DecodingResult decode(HmmModel model, int[] obs) {
        int T = obs.length;
        if (T == 0) {
            throw new HmmValidationException("Cannot decode a sequence of length 0");
        }
        int n = model.getNumStates();
        int m = model.getNumSymbols();
        for (int t = 0; t < T; t++) {
            if (obs[t] < 0 || obs[t] >= m) {
                throw new HmmValidationException(
                        "Symbol index " + obs[t] + " at position " + t + " outside [0, " + m + ")");
            }
        }
        double[][] a = model.getTransitions();
        double[][] b = model.getEmissions();
        double[] pi = model.getInitial();

        double[][] score = new double[T][n];
        int[][] backPointer = new int[T][n];

        for (int i = 0; i < n; i++) {
            score[0][i] = MathUtil.flooredLog(pi[i], PROBABILITY_FLOOR)
                    + MathUtil.flooredLog(b[i][obs[0]], PROBABILITY_FLOOR);
        }
        for (int t = 1; t < T; t++) {
            for (int j = 0; j < n; j++) {
                double best = Double.NEGATIVE_INFINITY;
                int bestPrev = 0;
                for (int i = 0; i < n; i++) {
                    double s = score[t - 1][i] + MathUtil.flooredLog(a[i][j], PROBABILITY_FLOOR);
                    if (s > best) {
                        best = s;
                        bestPrev = i;
                    }
                }
                score[t][j] = best + MathUtil.flooredLog(b[j][obs[t]], PROBABILITY_FLOOR);
                backPointer[t][j] = bestPrev;
            }
        }

        int last = MathUtil.argmax(score[T - 1]);
        int[] path = new int[T];
        path[T - 1] = last;
        for (int t = T - 2; t >= 0; t--) {
            path[t] = backPointer[t + 1][path[t + 1]];
        }
        return new DecodingResult(path, score[T - 1][last]);
    }
}
