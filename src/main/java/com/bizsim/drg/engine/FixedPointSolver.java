package com.bizsim.drg.engine;

import com.bizsim.drg.api.EvaluationListener;
import com.bizsim.drg.engine.GroupDiagnostics.Termination;
import com.bizsim.drg.graph.EvaluationGroup;

/**
 * Gauss-Seidel fixed-point iteration for one cyclic group.
 *
 * Algorithm:
 * 1. Initialise members to the warm-start values if given, else 0.
 * 2. Each iteration: remember member values, then re-evaluate members one by
 * one in declaration order against the live context, so a member sees updates
 * made earlier in the same iteration.
 * 3. maxDelta = max |new - previous| over the members. Converged when
 * maxDelta &lt; threshold.
 * 4. Stop at maxIterations (not converged), or when the deadline has passed.
 *
 * Cancellation and deadline are checked between iterations, never inside one.
 */
final class FixedPointSolver {
    private final EvaluationListener listener;

    FixedPointSolver(EvaluationListener listener) {
        this.listener = listener;
    }

    GroupDiagnostics solve(EvaluationGroup group, EvaluationContext ctx, RunOptions options, double[] initial,
            CancellationToken token) {
        final int m = group.memberCount();
        final boolean warm = initial != null && initial.length == m;
        for (int k = 0; k < m; k++)
            ctx.set(group.member(k), warm ? initial[k] : 0.0);

        // Per-iteration memo, discarded with the call.
        final double[] previous = new double[m];
        int iteration = 0;
        double maxDelta = Double.NaN;
        Termination termination = Termination.MAX_ITERATIONS;

        while (iteration < options.maxIterations()) {
            token.checkCancelled();
            iteration++;
            for (int k = 0; k < m; k++)
                previous[k] = ctx.get(group.member(k));
            for (int k = 0; k < m; k++)
                ctx.evaluate(group.member(k), iteration);

            maxDelta = 0.0;
            for (int k = 0; k < m; k++)
                maxDelta = Math.max(maxDelta, Math.abs(ctx.get(group.member(k)) - previous[k]));
            listener.onIteration(ctx.runId(), group.id(), iteration, maxDelta);

            if (maxDelta < options.threshold()) {
                termination = Termination.CONVERGED;
                break;
            }
            if (token.deadlineExceeded()) {
                termination = Termination.DEADLINE_EXCEEDED;
                break;
            }
        }

        ConvergenceResult result = new ConvergenceResult(termination == Termination.CONVERGED, iteration, maxDelta);
        return GroupDiagnostics.of(group.id(), group.identities(), result, termination);
    }
}
