package com.bizsim.drg.engine;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag plus optional wall-clock deadline for one run.
 * Checked by the scheduler between levels and by the solver between iterations.
 * A caller waiting on a shared computation also stops when its own token is cancelled.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<Void> cancelSignal = new CompletableFuture<>();
    private final long deadlineNanos;
    private final boolean hasDeadline;

    public CancellationToken() {
        this(null);
    }

    public CancellationToken(Duration deadline) {
        this.hasDeadline = deadline != null;
        this.deadlineNanos = hasDeadline ? System.nanoTime() + deadline.toNanos() : 0L;
    }

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /** Requests cancellation. Returns false if it was already requested. */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true))
            return false;
        cancelSignal.complete(null);
        return true;
    }

    /** Completes when {@link #cancel()} is first called. Never completes exceptionally. */
    public CompletableFuture<Void> whenCancelled() {
        return cancelSignal;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkCancelled() {
        if (cancelled.get())
            throw new RunCancelledException("Run cancelled");
    }

    public boolean deadlineExceeded() {
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }
}
