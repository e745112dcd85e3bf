package com.bizsim.drg.fn;

/** Ignores its dependencies and returns a fixed value. */
public class Constant extends AbstractFormula {
    private final double value;

    public Constant(double value) {
        if (!Double.isFinite(value))
            throw new IllegalArgumentException("Constant must be finite, got " + value);
        this.value = value;
    }

    @Override
    protected double calculate(double[] inputs) {
        return value;
    }
}
