package com.bizsim.drg.api;

/**
 * Read-only view over the declared dependencies of one calculated attribute.
 *
 * Only dependencies that were declared for the attribute are visible. Asking
 * for anything else throws, which keeps the declared graph and the actual
 * reads of a formula in agreement.
 *
 * Names may be given fully qualified ({@code Block.attribute}) or exactly as
 * they were written in the dependency declaration.
 */
public interface DependencySnapshot {

    /**
     * Returns the current value of a declared dependency.
     *
     * @param name Qualified identity or declared name of the dependency.
     * @return The dependency's current value.
     * @throws IllegalArgumentException if the name is not a declared dependency.
     */
    double get(String name);

    /**
     * Returns the value of the dependency at the given declaration position.
     *
     * @param position Zero-based position in the dependency declaration.
     * @return The dependency's current value.
     */
    double get(int position);

    /** Number of declared dependencies. */
    int size();
}
