package com.bizsim.drg.engine;

/**
 * States of one evaluation run.
 *
 * <pre>
 * INITIALIZING -> LEVEL_PROCESSING <-> CONVERGING
 * LEVEL_PROCESSING -> DONE | EXHAUSTED
 * any non-terminal -> FAILED | CANCELLED
 * </pre>
 *
 * DONE means every cyclic group converged. EXHAUSTED means the run completed
 * but at least one cyclic group stopped without converging (iteration cap or
 * deadline); its values are best-effort.
 */
public enum RunState {
    INITIALIZING,
    LEVEL_PROCESSING,
    CONVERGING,
    DONE,
    EXHAUSTED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == EXHAUSTED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(RunState next) {
        if (isTerminal())
            return false;
        if (next == FAILED || next == CANCELLED)
            return true;
        return switch (this) {
            case INITIALIZING -> next == LEVEL_PROCESSING;
            case LEVEL_PROCESSING -> next == CONVERGING || next == DONE || next == EXHAUSTED;
            case CONVERGING -> next == LEVEL_PROCESSING;
            default -> false;
        };
    }
}
