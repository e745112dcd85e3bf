package com.bizsim.drg.engine;

/**
 * Outcome of solving one cyclic group.
 *
 * @param converged  True if the last iteration's largest change was below the threshold.
 * @param iterations Number of iterations performed.
 * @param maxDelta   Largest absolute change in the last iteration.
 */
public record ConvergenceResult(boolean converged, int iterations, double maxDelta) {
}
