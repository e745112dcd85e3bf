package com.bizsim.drg.engine;

import java.util.List;

/**
 * Convergence diagnostics for one cyclic group in a run result.
 *
 * A group that did not converge is a diagnostic, not an error: the run still
 * returns its last computed values.
 *
 * @param groupId     Group number in the evaluation plan.
 * @param members     Qualified member identities in update order.
 * @param converged   Whether the group converged.
 * @param iterations  Iterations performed.
 * @param maxDelta    Largest change in the last iteration.
 * @param termination Why solving stopped.
 * @param reused      True if the values came from the group cache instead of being solved in this run.
 */
public record GroupDiagnostics(int groupId, List<String> members, boolean converged, int iterations, double maxDelta,
        Termination termination, boolean reused) {

    /** Why a cyclic group stopped iterating. */
    public enum Termination {
        CONVERGED,
        MAX_ITERATIONS,
        DEADLINE_EXCEEDED
    }

    public GroupDiagnostics {
        members = List.copyOf(members);
    }

    static GroupDiagnostics of(int groupId, List<String> members, ConvergenceResult result, Termination termination) {
        return new GroupDiagnostics(groupId, members, result.converged(), result.iterations(), result.maxDelta(),
                termination, false);
    }

    public ConvergenceResult convergence() {
        return new ConvergenceResult(converged, iterations, maxDelta);
    }

    GroupDiagnostics asReused() {
        return new GroupDiagnostics(groupId, members, converged, iterations, maxDelta, termination, true);
    }
}
