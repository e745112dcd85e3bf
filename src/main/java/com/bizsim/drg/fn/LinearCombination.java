package com.bizsim.drg.fn;

import java.util.Arrays;

/**
 * Weighted sum plus a constant.
 * <p>
 * Formula: {@code y = w0*x0 + w1*x1 + ... + c}
 */
public class LinearCombination extends AbstractFormula {
    private final double[] weights;
    private final double constant;

    public LinearCombination(double[] weights, double constant) {
        for (double w : weights)
            if (!Double.isFinite(w))
                throw new IllegalArgumentException("Weights must be finite: " + Arrays.toString(weights));
        if (!Double.isFinite(constant))
            throw new IllegalArgumentException("Constant must be finite, got " + constant);
        this.weights = weights.clone();
        this.constant = constant;
    }

    @Override
    protected double calculate(double[] inputs) {
        requireArity("linear", inputs, weights.length);
        double y = constant;
        for (int i = 0; i < inputs.length; i++)
            y += weights[i] * inputs[i];
        return y;
    }

    public int arity() {
        return weights.length;
    }
}
