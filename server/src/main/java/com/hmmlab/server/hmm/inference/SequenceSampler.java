package com.hmmlab.server.hmm.inference;

import com.hmmlab.server.hmm.HmmModel;
import com.hmmlab.server.hmm.HmmValidationException;

import java.util.Random;

/**
 * Generates (state, symbol) sequences from a model: the first state from Pi, each
 * later state from the previous state's row of A, and each symbol from B.
 */
public class SequenceSampler {

    private final Random random;

    public SequenceSampler(long seed) {
        this.random = new Random(seed);
    }

    public SampledSequence sample(HmmModel model, int length) {
        if (length < 1) {
            throw new HmmValidationException("Sample length must be >= 1, got " + length);
        }
        int[] states = new int[length];
        int[] symbols = new int[length];
        int current = -1;
        for (int t = 0; t < length; t++) {
            current = t == 0 ? draw(model.getInitial()) : draw(model.getTransitions()[current]);
            states[t] = current;
            symbols[t] = draw(model.getEmissions()[current]);
        }
        return new SampledSequence(states, symbols);
    }

    // Inverse CDF; rounding shortfall falls through to the last index.
    int draw(double[] probs) {
        double u = random.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < probs.length; i++) {
            cumulative += probs[i];
            if (u < cumulative) {
                return i;
            }
        }
        return probs.length - 1;
    }
}
