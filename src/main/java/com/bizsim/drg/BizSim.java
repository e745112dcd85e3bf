package com.bizsim.drg;

import com.bizsim.drg.dsl.SimulationBuilder;
import com.bizsim.drg.io.JsonModelLoader;
import com.bizsim.drg.io.LoadedModel;

/**
 * BizSim -- deterministic evaluation of cyclic business-metric models.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Blocks</b> group related metrics (Production, Logistics, ...).</li>
 * <li><b>Attributes</b> are inputs with a default value, or calculated from an
 * explicit dependency list by a pure formula.</li>
 * <li><b>Scenarios</b> override inputs by name; everything else keeps its
 * default.</li>
 * </ul>
 *
 * <h3>Evaluation</h3>
 * <ul>
 * <li>Dependencies form a graph that may contain feedback loops. Loops are
 * found as strongly connected components and solved by Gauss-Seidel
 * fixed-point iteration.</li>
 * <li>Independent parts of one level run in parallel; levels run in order.</li>
 * <li>Results are cached by a fingerprint of the resolved inputs, and per
 * group by the inputs upstream of it, so a changed input only recomputes what
 * depends on it.</li>
 * </ul>
 */
public final class BizSim {

    private BizSim() {
        // Utility class
    }

    /**
     * Entry point: define a model in code.
     *
     * @param modelName Descriptive model name.
     * @param version   Model version; cache entries are keyed by it.
     */
    public static SimulationBuilder builder(String modelName, String version) {
        return SimulationBuilder.create(modelName, version);
    }

    /** Entry point: load a JSON model from the classpath with the built-in formula types. */
    public static LoadedModel load(String resource) {
        return new JsonModelLoader().loadResource(resource);
    }
}
