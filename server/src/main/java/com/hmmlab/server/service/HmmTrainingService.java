package com.hmmlab.server.service;

import com.hmmlab.server.hmm.BaumWelchTrainer;
import com.hmmlab.server.hmm.ForwardScanner;
import com.hmmlab.server.hmm.HmmModel;
import com.hmmlab.server.hmm.HmmValidationException;
import com.hmmlab.server.hmm.ModelInitializer;
import com.hmmlab.server.hmm.TrainingConfig;
import com.hmmlab.server.hmm.TrainingResult;
import com.hmmlab.server.hmm.TrainingSet;
import com.hmmlab.server.hmm.inference.DecodingResult;
import com.hmmlab.server.hmm.inference.SampledSequence;
import com.hmmlab.server.hmm.inference.SequenceSampler;
import com.hmmlab.server.hmm.inference.ViterbiDecoder;
import com.hmmlab.server.util.ConfigPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class HmmTrainingService {

    private static final Logger logger = LoggerFactory.getLogger(HmmTrainingService.class);

    private final ConfigPathResolver.ConfigRoot config;

    public HmmTrainingService() {
        this(ConfigPathResolver.resolveConfig());
    }

    public HmmTrainingService(ConfigPathResolver.ConfigRoot config) {
        this.config = config;
        TrainingConfig tc = config.training;
        logger.info("HMM training service ready: maxIterations={}, convergenceThreshold={}, seed={}, parallel={}",
                tc.maxIterations, tc.convergenceThreshold, tc.seed, tc.parallel);
    }

    public TrainingConfig getTrainingConfig() {
        return config.training.copy();
    }

    public int getDefaultSampleLength() {
        return config.defaultSampleLength;
    }

    /**
     * Trains a model on the given sequences.
     *
     * @param initial caller-supplied starting parameters (init mode 1), or null to draw
     *                a seeded random model (init mode 0)
     * @param maxIter iteration budget, or null for the configured default
     */
    public TrainingReport train(int numStates, int numSymbols, List<int[]> observations, InitialParameters initial,
            Integer maxIter) {
        if (numStates < 1) {
            throw new HmmValidationException("State count N must be >= 1, got " + numStates);
        }
        TrainingSet trainingSet = new TrainingSet(numSymbols, observations);

        TrainingConfig tc = config.training.copy();
        if (maxIter != null) {
            tc.maxIterations = maxIter;
        }

        long start = System.nanoTime();
        HmmModel model;
        if (initial != null) {
            logger.debug("Using caller-supplied initialization");
            model = ModelInitializer.fromParameters(numStates, numSymbols, initial.getTransitions(),
                    initial.getEmissions(), initial.getInitial(), tc.rowSumTolerance);
        } else {
            model = ModelInitializer.random(numStates, numSymbols, tc.seed);
        }

        TrainingResult result = new BaumWelchTrainer(tc).train(model, trainingSet);
        double seconds = (System.nanoTime() - start) / 1e9;
        return new TrainingReport(result, seconds);
    }

    public DecodingResult decode(InitialParameters parameters, int[] observations) {
        HmmModel model = toModel(parameters);
        return new ViterbiDecoder().decode(model, observations);
    }

    public SampledSequence sample(InitialParameters parameters, Integer length, Long seed) {
        HmmModel model = toModel(parameters);
        int n = length != null ? length : config.defaultSampleLength;
        long s = seed != null ? seed : config.training.seed;
        return new SequenceSampler(s).sample(model, n);
    }

    public double logLikelihood(InitialParameters parameters, List<int[]> observations) {
        HmmModel model = toModel(parameters);
        TrainingSet set = new TrainingSet(model.getNumSymbols(), observations);
        return new ForwardScanner(config.training.epsilon).logLikelihood(model, set);
    }

    private HmmModel toModel(InitialParameters parameters) {
        if (parameters == null || parameters.getTransitions() == null || parameters.getEmissions() == null
                || parameters.getInitial() == null) {
            throw new HmmValidationException("Model parameters A, B and Pi are required");
        }
        double[][] b = parameters.getEmissions();
        int numStates = parameters.getTransitions().length;
        int numSymbols = b.length > 0 && b[0] != null ? b[0].length : 0;
        return ModelInitializer.fromParameters(numStates, numSymbols, parameters.getTransitions(), b,
                parameters.getInitial(), config.training.rowSumTolerance);
    }
}
