package com.hmmlab.server.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Baum-Welch iteration driver.
 * <p>
 * Each iteration runs the forward, backward and posterior stages for every
 * sequence, merges the per-sequence statistics in sequence order, records the
 * log-likelihood and re-estimates the model once. Training stops when the
 * iteration budget is spent or, if a convergence threshold is configured, when
 * the log-likelihood gain between consecutive iterations drops below it.
 */
public class BaumWelchTrainer {
    private static final Logger logger = LoggerFactory.getLogger(BaumWelchTrainer.class);

    private final TrainingConfig config;
    private final ForwardScanner forwardScanner;
    private final BackwardScanner backwardScanner;
    private final PosteriorAggregator posteriorAggregator;
    private final ReEstimator reEstimator;

    private TrainingState state = TrainingState.INITIALIZED;

    public BaumWelchTrainer(TrainingConfig config) {
        if (config.maxIterations < 0) {
            throw new HmmValidationException("Maximum iteration count must be >= 0, got " + config.maxIterations);
        }
        this.config = config.copy();
        this.forwardScanner = new ForwardScanner(config.epsilon);
        this.backwardScanner = new BackwardScanner();
        this.posteriorAggregator = new PosteriorAggregator(config.epsilon);
        this.reEstimator = new ReEstimator(config);
    }

    public TrainingState getState() {
        return state;
    }

    /**
     * Trains the model in place and returns a snapshot of the result.
     */
    public TrainingResult train(HmmModel model, TrainingSet trainingSet) {
        if (model.getNumSymbols() != trainingSet.getNumSymbols()) {
            throw new HmmValidationException("Model has M=" + model.getNumSymbols()
                    + " symbols but training set was validated against M=" + trainingSet.getNumSymbols());
        }
        logger.info("Starting Baum-Welch: N={}, M={}, K={}, T_total={}, maxIterations={}",
                model.getNumStates(), model.getNumSymbols(), trainingSet.size(), trainingSet.totalLength(),
                config.maxIterations);
        long startTime = System.currentTimeMillis();

        List<Double> history = new ArrayList<>();
        state = TrainingState.ITERATING;
        int iter = 0;
        while (iter < config.maxIterations) {
            SufficientStatistics stats = expectation(model, trainingSet);
            double logL = stats.getLogLikelihood();
            history.add(logL);
            logger.debug("Iteration {}: log-likelihood = {}", iter, logL);

            reEstimator.update(model, stats);
            iter++;

            if (config.isConvergenceCheckEnabled() && history.size() > 1) {
                double gain = logL - history.get(history.size() - 2);
                if (gain < config.convergenceThreshold) {
                    logger.info("Converged after {} iterations (gain {} < {})", iter, gain,
                            config.convergenceThreshold);
                    state = TrainingState.CONVERGED;
                    break;
                }
            }
        }
        if (state == TrainingState.ITERATING) {
            state = TrainingState.BUDGET_EXHAUSTED;
        }

        double finalLogL = forwardScanner.logLikelihood(model, trainingSet);
        long duration = System.currentTimeMillis() - startTime;
        logger.info("Training finished in {} ms: {} iterations, state={}, log-likelihood={}", duration, iter, state,
                finalLogL);
        return new TrainingResult(model.copy(), history, finalLogL, iter, state);
    }

    /**
     * E-step over the whole training set. Per-sequence records are merged in
     * sequence order whether or not they were computed in parallel.
     */
    SufficientStatistics expectation(HmmModel model, TrainingSet trainingSet) {
        IntStream indices = IntStream.range(0, trainingSet.size());
        if (config.parallel) {
            indices = indices.parallel();
        }
        List<SufficientStatistics> perSequence = indices
                .mapToObj(k -> sequenceStatistics(model, trainingSet.get(k)))
                .collect(Collectors.toList());

        SufficientStatistics total = new SufficientStatistics(model.getNumStates(), model.getNumSymbols());
        for (SufficientStatistics s : perSequence) {
            total.merge(s);
        }
        return total;
    }

    private SufficientStatistics sequenceStatistics(HmmModel model, int[] obs) {
        ForwardResult forward = forwardScanner.scan(model, obs);
        double[][] beta = backwardScanner.scan(model, obs, forward.getScale());
        SufficientStatistics stats = new SufficientStatistics(model.getNumStates(), model.getNumSymbols());
        posteriorAggregator.accumulate(model, obs, forward, beta, stats);
        return stats;
    }
}
