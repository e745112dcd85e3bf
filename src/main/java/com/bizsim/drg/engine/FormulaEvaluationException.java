package com.bizsim.drg.engine;

/**
 * A formula threw, or produced a NaN or infinite value.
 *
 * Scoped to one run: the run fails, nothing is cached, and shared state is
 * untouched. Iteration 0 means the attribute was evaluated outside a cyclic
 * group.
 */
public class FormulaEvaluationException extends RuntimeException {
    private final String identity;
    private final int iteration;

    public FormulaEvaluationException(String identity, int iteration, String message, Throwable cause) {
        super("Formula of '" + identity + "' failed" + (iteration > 0 ? " at iteration " + iteration : "") + ": "
                + message, cause);
        this.identity = identity;
        this.iteration = iteration;
    }

    public String identity() {
        return identity;
    }

    public int iteration() {
        return iteration;
    }
}
