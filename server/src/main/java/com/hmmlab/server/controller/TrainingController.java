package com.hmmlab.server.controller;

import com.hmmlab.server.hmm.HmmModel;
import com.hmmlab.server.hmm.HmmValidationException;
import com.hmmlab.server.hmm.TrainingResult;
import com.hmmlab.server.hmm.inference.DecodingResult;
import com.hmmlab.server.hmm.inference.SampledSequence;
import com.hmmlab.server.service.HmmTrainingService;
import com.hmmlab.server.service.InitialParameters;
import com.hmmlab.server.service.TrainingReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
public class TrainingController {

    private static final Logger logger = LoggerFactory.getLogger(TrainingController.class);
    private final HmmTrainingService trainingService;

    public TrainingController(HmmTrainingService trainingService) {
        this.trainingService = trainingService;
    }

    public static class ModelParams {
        public double[][] A;
        public double[][] B;
        public double[] Pi;
    }

    public static class TrainRequest {
        public Integer N;
        public Integer M;
        public List<List<Integer>> observations;
        // present selects caller-supplied initialization
        public ModelParams initParams;
        public Integer maxIter;
    }

    public static class DecodeRequest extends ModelParams {
        public List<Integer> observations;
    }

    public static class SampleRequest extends ModelParams {
        public Integer length;
        public Long seed;
    }

    public static class LikelihoodRequest extends ModelParams {
        public List<List<Integer>> observations;
    }

    public static class IterationRecord {
        public final int iter;
        public final double logLikelihood;

        public IterationRecord(int iter, double logLikelihood) {
            this.iter = iter;
            this.logLikelihood = logLikelihood;
        }
    }

    public static class TrainResponse {
        public int N;
        public int M;
        public double executionTime;
        public List<IterationRecord> history;
        public double[][] A;
        public double[][] B;
        public double[] Pi;
        public double finalLogLikelihood;
        public int iterations;
        public String state;
    }

    @PostMapping("/train")
    public ResponseEntity<?> train(@RequestBody TrainRequest request) {
        if (request == null || request.N == null || request.M == null || request.observations == null) {
            return ResponseEntity.badRequest().body(error("Missing parameters N, M, or observations"));
        }
        logger.info("Received training request: N={}, M={}, K={}", request.N, request.M,
                request.observations.size());

        InitialParameters initial = request.initParams != null ? toParameters(request.initParams) : null;
        TrainingReport report = trainingService.train(request.N, request.M, toSequences(request.observations),
                initial, request.maxIter);

        TrainingResult result = report.getResult();
        HmmModel model = result.getModel();
        TrainResponse response = new TrainResponse();
        response.N = model.getNumStates();
        response.M = model.getNumSymbols();
        response.executionTime = report.getExecutionTimeSeconds();
        response.history = new ArrayList<>();
        List<Double> history = result.getLogLikelihoodHistory();
        for (int i = 0; i < history.size(); i++) {
            response.history.add(new IterationRecord(i, history.get(i)));
        }
        response.A = model.getTransitions();
        response.B = model.getEmissions();
        response.Pi = model.getInitial();
        response.finalLogLikelihood = result.getFinalLogLikelihood();
        response.iterations = result.getIterations();
        response.state = result.getState().name();
        return ResponseEntity.ok(response);
    }

    @PostMapping("/viterbi")
    public ResponseEntity<?> viterbi(@RequestBody DecodeRequest request) {
        if (request == null || request.observations == null) {
            return ResponseEntity.badRequest().body(error("Missing parameter observations"));
        }
        DecodingResult result = trainingService.decode(toParameters(request), toSequence(request.observations, 0));
        return ResponseEntity.ok(Map.of("path", result.getPath(), "logProbability", result.getLogProbability()));
    }

    @PostMapping("/sample")
    public ResponseEntity<?> sample(@RequestBody SampleRequest request) {
        if (request == null) {
            return ResponseEntity.badRequest().body(error("Missing request body"));
        }
        SampledSequence sampled = trainingService.sample(toParameters(request), request.length, request.seed);
        return ResponseEntity.ok(Map.of("states", sampled.getStates(), "symbols", sampled.getSymbols()));
    }

    @PostMapping("/likelihood")
    public ResponseEntity<?> likelihood(@RequestBody LikelihoodRequest request) {
        if (request == null || request.observations == null) {
            return ResponseEntity.badRequest().body(error("Missing parameter observations"));
        }
        double logL = trainingService.logLikelihood(toParameters(request), toSequences(request.observations));
        return ResponseEntity.ok(Map.of("logLikelihood", logL));
    }

    @ExceptionHandler(HmmValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(HmmValidationException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error("Malformed request body"));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> handleFailure(RuntimeException e) {
        logger.error("Request failed", e);
        return ResponseEntity.status(500).body(error("HMM execution failed: " + e.getMessage()));
    }

    private static Map<String, String> error(String message) {
        return Map.of("error", message);
    }

    private static InitialParameters toParameters(ModelParams params) {
        return new InitialParameters(params.A, params.B, params.Pi);
    }

    private static List<int[]> toSequences(List<List<Integer>> observations) {
        List<int[]> sequences = new ArrayList<>(observations.size());
        for (int k = 0; k < observations.size(); k++) {
            sequences.add(toSequence(observations.get(k), k));
        }
        return sequences;
    }

    private static int[] toSequence(List<Integer> symbols, int index) {
        if (symbols == null) {
            throw new HmmValidationException("Sequence " + index + " is missing");
        }
        int[] seq = new int[symbols.size()];
        for (int t = 0; t < seq.length; t++) {
            Integer s = symbols.get(t);
            if (s == null) {
                throw new HmmValidationException("Symbol at position " + t + " of sequence " + index + " is null");
            }
            seq[t] = s;
        }
        return seq;
    }
}
