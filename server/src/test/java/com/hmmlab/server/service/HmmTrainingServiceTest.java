package com.hmmlab.server.service;

import com.hmmlab.server.hmm.HmmModel;
import com.hmmlab.server.hmm.HmmValidationException;
import com.hmmlab.server.hmm.TrainingResult;
import com.hmmlab.server.hmm.TrainingState;
import com.hmmlab.server.hmm.inference.DecodingResult;
import com.hmmlab.server.hmm.inference.SampledSequence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HmmTrainingServiceTest {

    private static InitialParameters switchingModel() {
        return new InitialParameters(
                new double[][] { { 0.1, 0.9 }, { 0.9, 0.1 } },
                new double[][] { { 0.95, 0.05 }, { 0.05, 0.95 } },
                new double[] { 0.5, 0.5 });
    }

    @Test
    public void testDefaultsComeFromConfigFile() {
        HmmTrainingService service = new HmmTrainingService();

        assertEquals(50, service.getTrainingConfig().maxIterations);
        assertEquals(20, service.getDefaultSampleLength());
    }

    @Test
    public void testRandomInitializationUsesDefaultBudget() {
        HmmTrainingService service = new HmmTrainingService();

        TrainingReport report = service.train(2, 2, List.of(new int[] { 0, 1, 0, 1, 0, 1, 0, 1 }), null, null);

        TrainingResult result = report.getResult();
        assertEquals(50, result.getIterations());
        assertEquals(TrainingState.BUDGET_EXHAUSTED, result.getState());
        assertTrue(result.getModel().isStochastic(1e-6));
        assertTrue(report.getExecutionTimeSeconds() >= 0.0);
    }

    @Test
    public void testCallerInitializationWithZeroIterations() {
        HmmTrainingService service = new HmmTrainingService();
        InitialParameters init = new InitialParameters(
                new double[][] { { 0.6, 0.4 }, { 0.3, 0.7 } },
                new double[][] { { 0.25, 0.25 }, { 0.2, 0.8 } },
                new double[] { 0.5, 0.5 });

        TrainingReport report = service.train(2, 2, List.of(new int[] { 0, 1 }), init, 0);

        HmmModel model = report.getResult().getModel();
        assertArrayEquals(new double[] { 0.6, 0.4 }, model.getTransitions()[0], 0.0);
        // The half-mass B row was renormalized before training
        assertArrayEquals(new double[] { 0.5, 0.5 }, model.getEmissions()[0], 1e-12);
    }

    @Test
    public void testShapeViolationsNamed() {
        HmmTrainingService service = new HmmTrainingService();

        HmmValidationException e = assertThrows(HmmValidationException.class,
                () -> service.train(0, 2, List.of(new int[] { 0 }), null, null));
        assertTrue(e.getMessage().contains("N must be >= 1"), e.getMessage());

        e = assertThrows(HmmValidationException.class,
                () -> service.train(2, 2, List.of(new int[] { 0, 5 }), null, null));
        assertTrue(e.getMessage().contains("outside [0, 2)"), e.getMessage());

        e = assertThrows(HmmValidationException.class,
                () -> service.train(2, 2, List.of(new int[] { 0 }), null, -3));
        assertTrue(e.getMessage().contains("iteration"), e.getMessage());
    }

    @Test
    public void testDecodeSampleAndScore() {
        HmmTrainingService service = new HmmTrainingService();

        DecodingResult decoded = service.decode(switchingModel(), new int[] { 0, 1, 0 });
        assertArrayEquals(new int[] { 0, 1, 0 }, decoded.getPath());

        SampledSequence sampled = service.sample(switchingModel(), null, 5L);
        assertEquals(20, sampled.length());

        double logL = service.logLikelihood(switchingModel(), List.of(new int[] { 0, 1, 0 }, new int[] { 1 }));
        assertTrue(logL < 0.0);
        assertTrue(logL > Math.log(1e-3));
    }

    @Test
    public void testMissingModelRejected() {
        HmmTrainingService service = new HmmTrainingService();
        assertThrows(HmmValidationException.class,
                () -> service.decode(new InitialParameters(null, null, null), new int[] { 0 }));
    }
}
