package com.bizsim.drg.fn;

/**
 * Quotient of the first two dependencies.
 * <p>
 * Formula: {@code y = x0 / x1}. A zero denominator yields an infinite or NaN
 * result, which fails the run.
 */
public class Ratio extends AbstractFormula {
    @Override
    protected double calculate(double[] inputs) {
        requireArity("ratio", inputs, 2);
        return inputs[0] / inputs[1];
    }
}
