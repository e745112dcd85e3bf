package com.bizsim.drg.dsl;

import com.bizsim.drg.api.Formula;
import com.bizsim.drg.engine.EngineConfig;
import com.bizsim.drg.engine.SimulationEngine;
import com.bizsim.drg.fn.LinearCombination;
import com.bizsim.drg.model.ModelRegistry;
import com.bizsim.drg.model.Scenario;
import com.bizsim.drg.model.ScenarioStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simulation Builder -- fluent API for defining a model in code.
 *
 * Usage Pattern:
 * 1. Create a builder: SimulationBuilder sim = SimulationBuilder.create("costs", "1.0");
 * 2. Define blocks: sim.block("Production").input("materialCost", 120).calculated(...);
 * 3. Define scenarios: sim.scenario("High").override("Production", "energyCost", 90);
 * 4. Build: SimulationEngine engine = sim.build();
 *
 * Dependencies are always declared explicitly next to the formula; a name
 * without a block prefix refers to the same block. Forward and cross-block
 * references are fine, they are resolved when the model is sealed.
 */
public final class SimulationBuilder {
    private final ModelRegistry.Builder model;
    private final Map<String, ScenarioBuilder> scenarios = new LinkedHashMap<>();
    private final Map<String, BlockBuilder> blocks = new LinkedHashMap<>();
    private ModelRegistry registry;
    private ScenarioStore store;

    private SimulationBuilder(String modelName, String version) {
        this.model = ModelRegistry.builder(modelName, version);
    }

    public static SimulationBuilder create(String modelName, String version) {
        return new SimulationBuilder(modelName, version);
    }

    // ── Model ────────────────────────────────────────────────────

    /** Defines a block, or returns the builder of an already defined one. */
    public BlockBuilder block(String name) {
        checkNotBuilt();
        BlockBuilder b = blocks.get(name);
        if (b == null) {
            model.defineBlock(name);
            b = new BlockBuilder(name);
            blocks.put(name, b);
        }
        return b;
    }

    /** Adds attributes to one block. */
    public final class BlockBuilder {
        private final String block;

        private BlockBuilder(String block) {
            this.block = block;
        }

        public BlockBuilder input(String name, double defaultValue) {
            checkNotBuilt();
            model.defineInput(block, name, defaultValue);
            return this;
        }

        /**
         * @param formula      Pure function of the declared dependencies.
         * @param dependencies Every attribute the formula reads; none means "reads nothing".
         */
        public BlockBuilder calculated(String name, Formula formula, String... dependencies) {
            checkNotBuilt();
            model.defineCalculated(block, name, formula, dependencies);
            return this;
        }

        /** {@code name = weights[0]*deps[0] + ... + constant}. */
        public BlockBuilder linear(String name, double[] weights, double constant, String... dependencies) {
            if (weights.length != dependencies.length)
                throw new IllegalArgumentException(
                        block + "." + name + ": " + weights.length + " weights for " + dependencies.length
                                + " dependencies");
            return calculated(name, new LinearCombination(weights, constant), dependencies);
        }

        public BlockBuilder block(String name) {
            return SimulationBuilder.this.block(name);
        }

        public ScenarioBuilder scenario(String name) {
            return SimulationBuilder.this.scenario(name);
        }

        public SimulationBuilder done() {
            return SimulationBuilder.this;
        }
    }

    // ── Scenarios ────────────────────────────────────────────────

    /** Defines a scenario, or returns the builder of an already defined one. */
    public ScenarioBuilder scenario(String name) {
        checkNotBuilt();
        return scenarios.computeIfAbsent(name, ScenarioBuilder::new);
    }

    /** Collects overrides for one scenario. */
    public final class ScenarioBuilder {
        private final String name;
        private final Map<String, Double> overrides = new LinkedHashMap<>();

        private ScenarioBuilder(String name) {
            this.name = name;
        }

        public ScenarioBuilder override(String block, String attribute, double value) {
            return override(block + "." + attribute, value);
        }

        public ScenarioBuilder override(String identity, double value) {
            checkNotBuilt();
            overrides.put(identity, value);
            return this;
        }

        public ScenarioBuilder scenario(String other) {
            return SimulationBuilder.this.scenario(other);
        }

        public SimulationBuilder done() {
            return SimulationBuilder.this;
        }
    }

    // ── Build ────────────────────────────────────────────────────

    /** Seals the model. Idempotent. */
    public ModelRegistry registry() {
        if (registry == null)
            registry = model.seal();
        return registry;
    }

    /** Seals the model and validates the scenarios against it. Idempotent. */
    public ScenarioStore scenarios() {
        if (store == null) {
            ScenarioStore.Builder b = ScenarioStore.builder();
            for (ScenarioBuilder s : scenarios.values())
                b.defineScenario(new Scenario(s.name, s.overrides));
            store = b.seal(registry());
        }
        return store;
    }

    public SimulationEngine build() {
        return new SimulationEngine(registry(), scenarios());
    }

    public SimulationEngine build(EngineConfig config) {
        return new SimulationEngine(registry(), scenarios(), config);
    }

    private void checkNotBuilt() {
        if (store != null || registry != null)
            throw new IllegalStateException("Model is already built");
    }
}
