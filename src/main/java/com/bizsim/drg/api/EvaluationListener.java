package com.bizsim.drg.api;

import com.bizsim.drg.engine.GroupDiagnostics;
import com.bizsim.drg.engine.RunState;

/**
 * Observability interface for monitoring simulation runs.
 *
 * Implementations can be registered with the SimulationEngine to receive
 * callbacks during evaluation. This is the primary mechanism for:
 *
 * - Profiling: Measuring how long attribute evaluation and solving takes.
 * - Debugging: Tracing which attributes are recomputed and how a cyclic group
 * converges iteration by iteration.
 * - Metrics: Counting runs, cache hits and failures.
 *
 * Threading Warning:
 * Attributes of one level are evaluated concurrently on the worker pool, so
 * these callbacks may be invoked from several threads at once. Implementations
 * must be thread-safe and lightweight.
 */
public interface EvaluationListener {

    /**
     * Called when the scheduler starts a run (cache misses only).
     *
     * @param runId    Engine-unique run number.
     * @param scenario Name of the scenario being evaluated.
     */
    default void onRunStart(long runId, String scenario) {
    }

    /**
     * Called on every state machine transition of a run.
     */
    default void onStateChange(long runId, RunState from, RunState to) {
    }

    /**
     * Called after a calculated attribute has been evaluated.
     *
     * @param runId         Run number.
     * @param identity      Qualified attribute identity.
     * @param value         The new value.
     * @param durationNanos Time spent in the formula.
     */
    default void onAttributeEvaluated(long runId, String identity, double value, long durationNanos) {
    }

    /**
     * Called after each fixed-point iteration of a cyclic group.
     *
     * @param runId     Run number.
     * @param groupId   Group number within the evaluation plan.
     * @param iteration One-based iteration number.
     * @param maxDelta  Largest absolute change across the group in this iteration.
     */
    default void onIteration(long runId, int groupId, int iteration, double maxDelta) {
    }

    /**
     * Called once a cyclic group has finished solving (converged or not).
     */
    default void onGroupSolved(long runId, GroupDiagnostics diagnostics) {
    }

    /**
     * Called when a formula fails.
     *
     * @param runId    Run number.
     * @param identity The failing attribute.
     * @param error    The failure.
     */
    default void onAttributeError(long runId, String identity, Throwable error) {
    }

    /**
     * Called when a run reaches a terminal state.
     */
    default void onRunEnd(long runId, RunState finalState) {
    }
}
