package com.bizsim.drg.fn;

/** Smallest or largest dependency value. */
public class Extremum extends AbstractFormula {
    private final boolean max;

    private Extremum(boolean max) {
        this.max = max;
    }

    public static Extremum min() {
        return new Extremum(false);
    }

    public static Extremum max() {
        return new Extremum(true);
    }

    @Override
    protected double calculate(double[] inputs) {
        requireAtLeastOne(max ? "max" : "min", inputs);
        double r = inputs[0];
        for (int i = 1; i < inputs.length; i++)
            r = max ? Math.max(r, inputs[i]) : Math.min(r, inputs[i]);
        return r;
    }
}
