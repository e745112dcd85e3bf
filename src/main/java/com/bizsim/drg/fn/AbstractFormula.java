package com.bizsim.drg.fn;

import com.bizsim.drg.api.DependencySnapshot;
import com.bizsim.drg.api.Formula;

/**
 * Base class for formulas over the positional dependency values.
 * <p>
 * Copies the declared dependencies into an array in declaration order and
 * hands them to {@link #calculate(double[])}. Errors are not swallowed: the
 * scheduler turns them into a failed run naming the attribute.
 */
public abstract class AbstractFormula implements Formula {

    @Override
    public final double evaluate(DependencySnapshot deps) {
        double[] inputs = new double[deps.size()];
        for (int i = 0; i < inputs.length; i++)
            inputs[i] = deps.get(i);
        return calculate(inputs);
    }

    /**
     * Subclasses implement the actual logic here.
     */
    protected abstract double calculate(double[] inputs);

    protected static void requireArity(String formula, double[] inputs, int expected) {
        if (inputs.length != expected)
            throw new IllegalArgumentException(
                    formula + " expects " + expected + " dependencies, got " + inputs.length);
    }

    protected static void requireAtLeastOne(String formula, double[] inputs) {
        if (inputs.length == 0)
            throw new IllegalArgumentException(formula + " needs at least one dependency");
    }
}
