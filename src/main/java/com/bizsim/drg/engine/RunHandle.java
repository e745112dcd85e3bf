package com.bizsim.drg.engine;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to an asynchronously submitted run.
 *
 * {@link #cancel()} is cooperative: the run stops at its next level boundary or
 * solver iteration and completes with {@link RunCancelledException}.
 */
public final class RunHandle {
    private final String scenarioName;
    private final CompletableFuture<SimulationResult> future;
    private final CancellationToken token;

    RunHandle(String scenarioName, CompletableFuture<SimulationResult> future, CancellationToken token) {
        this.scenarioName = scenarioName;
        this.future = future;
        this.token = token;
    }

    public String scenarioName() {
        return scenarioName;
    }

    /** Requests cancellation. Returns false if already requested. */
    public boolean cancel() {
        return token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Waits for the run and returns its result.
     *
     * @throws FormulaEvaluationException if the run failed.
     * @throws RunCancelledException      if the run was cancelled.
     */
    public SimulationResult await() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    public SimulationResult await(long timeout, TimeUnit unit) throws TimeoutException, InterruptedException {
        try {
            return future.get(timeout, unit);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    public CompletableFuture<SimulationResult> future() {
        return future;
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re)
            return re;
        if (cause instanceof Error err)
            throw err;
        return new CompletionException(cause);
    }
}
