package com.bizsim.drg.fn;

/** {@code y = x0 + x1 + ...}; 0 with no dependencies. */
public class Sum extends AbstractFormula {
    @Override
    protected double calculate(double[] inputs) {
        double sum = 0;
        for (double v : inputs)
            sum += v;
        return sum;
    }
}
