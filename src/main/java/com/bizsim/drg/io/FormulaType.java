package com.bizsim.drg.io;

import com.bizsim.drg.fn.Constant;
import com.bizsim.drg.fn.Extremum;
import com.bizsim.drg.fn.LinearCombination;
import com.bizsim.drg.fn.Product;
import com.bizsim.drg.fn.Ratio;
import com.bizsim.drg.fn.Sum;
import com.bizsim.drg.model.ModelDefinitionException;
import com.bizsim.drg.model.ModelDefinitionException.ErrorKind;

import java.util.Arrays;

/**
 * Built-in formula types available to JSON models, by name.
 */
public enum FormulaType {
    /** {@code weights} (default all 1) and {@code constant} (default 0). */
    LINEAR((id, props, n) -> {
        double[] weights = FormulaRegistry.getDoubleArray(props, "weights", null);
        if (weights == null) {
            weights = new double[n];
            Arrays.fill(weights, 1.0);
        }
        if (weights.length != n)
            throw new ModelDefinitionException(ErrorKind.INVALID_VALUE, id,
                    "linear needs one weight per dependency: " + weights.length + " weights, " + n + " dependencies");
        return new LinearCombination(weights, FormulaRegistry.getDouble(props, "constant", 0.0));
    }),
    SUM((id, props, n) -> new Sum()),
    PRODUCT((id, props, n) -> {
        requireAtLeastOne(id, "product", n);
        return new Product();
    }),
    RATIO((id, props, n) -> {
        if (n != 2)
            throw new ModelDefinitionException(ErrorKind.INVALID_VALUE, id,
                    "ratio needs exactly 2 dependencies, got " + n);
        return new Ratio();
    }),
    MIN((id, props, n) -> {
        requireAtLeastOne(id, "min", n);
        return Extremum.min();
    }),
    MAX((id, props, n) -> {
        requireAtLeastOne(id, "max", n);
        return Extremum.max();
    }),
    CONSTANT((id, props, n) -> new Constant(FormulaRegistry.getDouble(props, "value", 0.0)));

    private final FormulaFactory factory;

    FormulaType(FormulaFactory factory) {
        this.factory = factory;
    }

    public FormulaFactory factory() {
        return factory;
    }

    /** Name used in JSON, e.g. {@code "linear"}. */
    public String jsonName() {
        return name().toLowerCase();
    }

    private static void requireAtLeastOne(String id, String type, int n) {
        if (n == 0)
            throw new ModelDefinitionException(ErrorKind.INVALID_VALUE, id, type + " needs at least one dependency");
    }
}
