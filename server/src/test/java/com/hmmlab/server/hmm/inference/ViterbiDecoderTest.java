package com.hmmlab.server.hmm.inference;

import com.hmmlab.server.hmm.HmmModel;
import com.hmmlab.server.hmm.HmmValidationException;
import com.hmmlab.server.hmm.ModelInitializer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ViterbiDecoderTest {

    private final ViterbiDecoder decoder = new ViterbiDecoder();

    @Test
    void testDeterministicEmissionsAreRecovered() {
        HmmModel model = new HmmModel(
                new double[][] { { 0.1, 0.9 }, { 0.9, 0.1 } },
                new double[][] { { 1.0, 0.0 }, { 0.0, 1.0 } },
                new double[] { 0.5, 0.5 });

        DecodingResult result = decoder.decode(model, new int[] { 0, 1, 0, 0, 1 });

        assertArrayEquals(new int[] { 0, 1, 0, 0, 1 }, result.getPath());
        double expected = Math.log(0.5) + 3 * Math.log(0.9) + Math.log(0.1);
        assertEquals(expected, result.getLogProbability(), 1e-9);
    }

    @Test
    void testMatchesExhaustiveSearch() {
        HmmModel model = ModelInitializer.random(3, 2, 9L);
        int[] obs = { 1, 0, 0, 1, 1 };

        DecodingResult result = decoder.decode(model, obs);

        double best = Double.NEGATIVE_INFINITY;
        int[] bestPath = null;
        int paths = (int) Math.pow(3, obs.length);
        for (int code = 0; code < paths; code++) {
            int[] path = new int[obs.length];
            int rest = code;
            for (int t = 0; t < obs.length; t++) {
                path[t] = rest % 3;
                rest /= 3;
            }
            double logP = Math.log(model.getInitial()[path[0]]) + Math.log(model.getEmissions()[path[0]][obs[0]]);
            for (int t = 1; t < obs.length; t++) {
                logP += Math.log(model.getTransitions()[path[t - 1]][path[t]])
                        + Math.log(model.getEmissions()[path[t]][obs[t]]);
            }
            if (logP > best) {
                best = logP;
                bestPath = path;
            }
        }
        assertEquals(best, result.getLogProbability(), 1e-9);
        assertArrayEquals(bestPath, result.getPath());
    }

    @Test
    void testZeroProbabilitiesAreFloored() {
        HmmModel model = new HmmModel(
                new double[][] { { 1.0, 0.0 }, { 0.0, 1.0 } },
                new double[][] { { 1.0, 0.0 }, { 1.0, 0.0 } },
                new double[] { 1.0, 0.0 });

        DecodingResult result = decoder.decode(model, new int[] { 0, 1 });

        assertEquals(2, result.getPath().length);
        assertTrue(Double.isFinite(result.getLogProbability()));
    }

    @Test
    void testInvalidSequencesRejected() {
        HmmModel model = ModelInitializer.random(2, 2, 1L);
        assertThrows(HmmValidationException.class, () -> decoder.decode(model, new int[0]));
        assertThrows(HmmValidationException.class, () -> decoder.decode(model, new int[] { 0, 2 }));
    }
}
