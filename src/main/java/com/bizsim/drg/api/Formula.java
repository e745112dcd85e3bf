package com.bizsim.drg.api;

/**
 * A pure function computing one calculated attribute from its declared
 * dependencies.
 *
 * Contract:
 * - The formula only reads the values exposed by the {@link DependencySnapshot}.
 * It must not capture ambient mutable state; the engine relies on formulas
 * being deterministic to cache results across runs.
 * - The result must be a finite double. NaN or infinite results fail the run
 * with a FormulaEvaluationException naming the attribute.
 *
 * Example:
 *
 * <pre>{@code
 * Formula disposal = deps -> deps.get("materialCost") * 0.8 + deps.get("co2Cost");
 * }</pre>
 */
@FunctionalInterface
public interface Formula {

    /**
     * Evaluates the formula.
     *
     * @param deps Read-only view over the declared dependencies.
     * @return The new value of the attribute.
     */
    double evaluate(DependencySnapshot deps);
}
