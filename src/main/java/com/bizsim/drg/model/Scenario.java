package com.bizsim.drg.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named set of input overrides applied on top of attribute defaults.
 *
 * @param name      Scenario name.
 * @param overrides Qualified input identity to override value, in insertion order.
 */
public record Scenario(String name, Map<String, Double> overrides) {

    public Scenario {
        Objects.requireNonNull(name, "name");
        overrides = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(overrides, "overrides")));
    }

    /** A scenario that keeps every input at its default. */
    public static Scenario defaults(String name) {
        return new Scenario(name, Map.of());
    }

    /**
     * Builds a scenario from overrides grouped per block, e.g.
     * {@code {Production: {energyCost: 90}}}.
     */
    public static Scenario ofBlocks(String name, Map<String, Map<String, Double>> overridesByBlock) {
        Map<String, Double> flat = new LinkedHashMap<>();
        overridesByBlock.forEach((block, values) -> values
                .forEach((attribute, value) -> flat.put(Attribute.qualify(block, attribute), value)));
        return new Scenario(name, flat);
    }

    /** Returns a copy with extra overrides layered on top (later values win). */
    public Scenario withOverrides(String newName, Map<String, Double> extra) {
        Map<String, Double> merged = new LinkedHashMap<>(overrides);
        merged.putAll(extra);
        return new Scenario(newName, merged);
    }
}
