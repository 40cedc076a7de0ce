package com.hmmlab.server.hmm;

public class TrainingConfig {
    public int maxIterations = 50;
    // <= 0 disables early stopping
    public double convergenceThreshold = 0.0;
    public double epsilon = 1e-10;
    public long seed = 42L;
    public double minOccupancy = 1e-10;
    public double rowSumTolerance = 1e-9;
    public boolean parallel = false;

    public TrainingConfig() {
    }

    public TrainingConfig(
            int maxIterations,
            double convergenceThreshold,
            double epsilon,
            long seed,
            double minOccupancy,
            double rowSumTolerance,
            boolean parallel) {
        this.maxIterations = maxIterations;
        this.convergenceThreshold = convergenceThreshold;
        this.epsilon = epsilon;
        this.seed = seed;
        this.minOccupancy = minOccupancy;
        this.rowSumTolerance = rowSumTolerance;
        this.parallel = parallel;
    }

    public static TrainingConfig defaults() {
        return new TrainingConfig(50, 0.0, 1e-10, 42L, 1e-10, 1e-9, false);
    }

    public boolean isConvergenceCheckEnabled() {
        return convergenceThreshold > 0.0;
    }

    public TrainingConfig copy() {
        return new TrainingConfig(
                this.maxIterations,
                this.convergenceThreshold,
                this.epsilon,
                this.seed,
                this.minOccupancy,
                this.rowSumTolerance,
                this.parallel);
    }
}
