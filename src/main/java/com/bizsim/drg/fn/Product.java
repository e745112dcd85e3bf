package com.bizsim.drg.fn;

/** {@code y = x0 * x1 * ...} */
public class Product extends AbstractFormula {
    @Override
    protected double calculate(double[] inputs) {
        requireAtLeastOne("product", inputs);
        double p = 1;
        for (double v : inputs)
            p *= v;
        return p;
    }
}
