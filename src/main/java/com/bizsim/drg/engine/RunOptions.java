package com.bizsim.drg.engine;

import java.time.Duration;

/**
 * Per-run solver options.
 *
 * @param maxIterations Deterministic cap on fixed-point iterations per cyclic group (at least 1).
 * @param threshold     A cyclic group converges once the largest per-iteration change drops below this.
 * @param deadline      Optional wall-clock budget for the whole run, checked between iterations; null for none.
 * @param warmStart     Start cyclic groups from their most recently computed values instead of zero.
 *                      Warm-started results depend on run history and are never cached.
 */
public record RunOptions(int maxIterations, double threshold, Duration deadline, boolean warmStart) {

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_THRESHOLD = 0.001;

    public RunOptions {
        if (maxIterations < 1)
            throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
        if (!(threshold > 0) || !Double.isFinite(threshold))
            throw new IllegalArgumentException("threshold must be a positive finite number, got " + threshold);
        if (deadline != null && (deadline.isNegative() || deadline.isZero()))
            throw new IllegalArgumentException("deadline must be positive, got " + deadline);
    }

    public static RunOptions defaults() {
        return new RunOptions(DEFAULT_MAX_ITERATIONS, DEFAULT_THRESHOLD, null, false);
    }

    public static RunOptions of(int maxIterations, double threshold) {
        return new RunOptions(maxIterations, threshold, null, false);
    }

    public RunOptions withMaxIterations(int value) {
        return new RunOptions(value, threshold, deadline, warmStart);
    }

    public RunOptions withThreshold(double value) {
        return new RunOptions(maxIterations, value, deadline, warmStart);
    }

    public RunOptions withDeadline(Duration value) {
        return new RunOptions(maxIterations, threshold, value, warmStart);
    }

    public RunOptions withWarmStart(boolean value) {
        return new RunOptions(maxIterations, threshold, deadline, value);
    }
}
