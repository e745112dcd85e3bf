package com.bizsim.drg.io;

import com.bizsim.drg.engine.EngineConfig;
import com.bizsim.drg.engine.SimulationEngine;
import com.bizsim.drg.model.ModelRegistry;
import com.bizsim.drg.model.ScenarioStore;

/**
 * A compiled model file: the sealed registry and its scenarios.
 */
public record LoadedModel(ModelRegistry registry, ScenarioStore scenarios) {

    public SimulationEngine newEngine(EngineConfig config) {
        return new SimulationEngine(registry, scenarios, config);
    }

    public SimulationEngine newEngine() {
        return new SimulationEngine(registry, scenarios);
    }
}
