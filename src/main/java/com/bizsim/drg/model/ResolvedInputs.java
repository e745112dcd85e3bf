package com.bizsim.drg.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The total, validated mapping of every input attribute to its effective value
 * for one scenario, in declaration order.
 */
public final class ResolvedInputs {
    private final String scenarioName;
    private final Map<String, Double> values;

    ResolvedInputs(String scenarioName, LinkedHashMap<String, Double> values) {
        this.scenarioName = scenarioName;
        this.values = Collections.unmodifiableMap(values);
    }

    public String scenarioName() {
        return scenarioName;
    }

    /**
     * Effective value of an input.
     *
     * @throws IllegalArgumentException if the identity is not an input of the model.
     */
    public double get(String identity) {
        Double v = values.get(identity);
        if (v == null)
            throw new IllegalArgumentException("Not a resolved input: " + identity);
        return v;
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResolvedInputs other && scenarioName.equals(other.scenarioName)
                && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * scenarioName.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return "ResolvedInputs[" + scenarioName + "=" + values + "]";
    }
}
