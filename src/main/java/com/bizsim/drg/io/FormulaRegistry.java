package com.bizsim.drg.io;

import com.bizsim.drg.api.Formula;
import com.bizsim.drg.model.ModelDefinitionException;
import com.bizsim.drg.model.ModelDefinitionException.ErrorKind;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry mapping formula type names to their factories.
 * <p>
 * Starts with the {@link FormulaType} built-ins. Applications add their own
 * domain formulas with {@link #registerFactory(String, FormulaFactory)}; names
 * are case-insensitive and a later registration replaces an earlier one.
 */
public final class FormulaRegistry {
    private final Map<String, FormulaFactory> factories = new ConcurrentHashMap<>();

    public FormulaRegistry() {
        registerBuiltIns();
    }

    public FormulaRegistry registerBuiltIns() {
        for (FormulaType type : FormulaType.values())
            factories.put(type.jsonName(), type.factory());
        return this;
    }

    public FormulaRegistry registerFactory(String type, FormulaFactory factory) {
        factories.put(normalize(type), factory);
        return this;
    }

    public boolean contains(String type) {
        return type != null && factories.containsKey(normalize(type));
    }

    public Set<String> types() {
        return new TreeSet<>(factories.keySet());
    }

    /**
     * @throws ModelDefinitionException UNKNOWN_FORMULA if no factory is registered under the type.
     */
    public Formula create(String type, String identity, Map<String, Object> properties, int dependencyCount) {
        FormulaFactory factory = type == null ? null : factories.get(normalize(type));
        if (factory == null)
            throw new ModelDefinitionException(ErrorKind.UNKNOWN_FORMULA, identity,
                    "Unknown formula type '" + type + "', known: " + types());
        return factory.create(identity, properties == null ? Map.of() : properties, dependencyCount);
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase();
    }

    static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }

    static double[] getDoubleArray(Map<String, Object> props, String key, double[] def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        if (v instanceof List<?> list) {
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                Object o = list.get(i);
                out[i] = o instanceof Number n ? n.doubleValue() : Double.parseDouble(String.valueOf(o));
            }
            return out;
        }
        throw new IllegalArgumentException("Property '" + key + "' must be an array, got " + v);
    }
}
