package com.bizsim.drg.io;

import com.bizsim.drg.api.Formula;

import java.util.Map;

/** Creates a formula from the {@code properties} of a JSON attribute definition. */
@FunctionalInterface
public interface FormulaFactory {

    /**
     * @param identity        Qualified identity of the attribute, for error messages.
     * @param properties      The attribute's properties, never null.
     * @param dependencyCount Number of declared dependencies.
     */
    Formula create(String identity, Map<String, Object> properties, int dependencyCount);
}
