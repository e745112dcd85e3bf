package com.bizsim.drg.model;

import com.bizsim.drg.model.ModelDefinitionException.ErrorKind;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Immutable store of named scenarios for one model version.
 *
 * Input resolution is an explicit layered step:
 * 1. Defaults: every input attribute starts at its declared default.
 * 2. Overrides: the scenario's overrides replace defaults (override wins).
 *
 * The result is a total mapping over all input attributes. Overrides that name
 * an unknown attribute, target a calculated attribute or carry a non-finite
 * value are rejected with INVALID_OVERRIDE.
 */
public final class ScenarioStore {
    private static final Logger log = LogManager.getLogger(ScenarioStore.class);

    private final Map<String, Scenario> scenarios;

    private ScenarioStore(Map<String, Scenario> scenarios) {
        this.scenarios = Collections.unmodifiableMap(new LinkedHashMap<>(scenarios));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a scenario by name.
     *
     * @throws ModelDefinitionException with UNKNOWN_SCENARIO if absent.
     */
    public Scenario scenario(String name) {
        Scenario s = scenarios.get(name);
        if (s == null)
            throw new ModelDefinitionException(ErrorKind.UNKNOWN_SCENARIO, String.valueOf(name),
                    "No such scenario");
        return s;
    }

    public boolean contains(String name) {
        return scenarios.containsKey(name);
    }

    /** Scenario names in definition order. */
    public List<String> scenarioNames() {
        return List.copyOf(scenarios.keySet());
    }

    /** Resolves the effective inputs of a stored scenario. */
    public ResolvedInputs resolveInputs(String scenarioName, ModelRegistry registry) {
        return resolveInputs(scenario(scenarioName), registry);
    }

    /**
     * Resolves the effective inputs of any scenario (stored or ad hoc) against a
     * registry: defaults first, then overrides.
     */
    public static ResolvedInputs resolveInputs(Scenario scenario, ModelRegistry registry) {
        validate(scenario, registry);
        LinkedHashMap<String, Double> values = new LinkedHashMap<>();
        for (Attribute input : registry.inputs()) {
            Double override = scenario.overrides().get(input.identity());
            values.put(input.identity(), override != null ? override : input.defaultValue());
        }
        return new ResolvedInputs(scenario.name(), values);
    }

    static void validate(Scenario scenario, ModelRegistry registry) {
        for (Map.Entry<String, Double> e : scenario.overrides().entrySet()) {
            String id = e.getKey();
            Attribute target = registry.find(id).orElseThrow(() -> new ModelDefinitionException(
                    ErrorKind.INVALID_OVERRIDE, id, "Scenario '" + scenario.name() + "' overrides an unknown attribute"));
            if (!target.isInput())
                throw new ModelDefinitionException(ErrorKind.INVALID_OVERRIDE, id,
                        "Scenario '" + scenario.name() + "' overrides a calculated attribute");
            Double v = e.getValue();
            if (v == null || !Double.isFinite(v))
                throw new ModelDefinitionException(ErrorKind.INVALID_OVERRIDE, id,
                        "Scenario '" + scenario.name() + "' override must be finite, got " + v);
        }
    }

    /** Collects scenario definitions and validates them against a sealed registry. */
    public static final class Builder {
        private final Map<String, Scenario> scenarios = new LinkedHashMap<>();
        private boolean sealed;

        private Builder() {
        }

        public Builder defineScenario(String name, Map<String, Double> overrides) {
            return defineScenario(new Scenario(name, overrides));
        }

        public Builder defineScenario(Scenario scenario) {
            if (sealed)
                throw new IllegalStateException("Scenario store is sealed");
            if (scenarios.putIfAbsent(scenario.name(), scenario) != null)
                throw new ModelDefinitionException(ErrorKind.DUPLICATE_SCENARIO, scenario.name(),
                        "Scenario already defined");
            return this;
        }

        /**
         * Validates every scenario against the registry and returns the read-only store.
         */
        public ScenarioStore seal(ModelRegistry registry) {
            for (Scenario s : scenarios.values())
                validate(s, registry);
            sealed = true;
            log.debug("Sealed {} scenarios for {}@{}", scenarios.size(), registry.modelName(), registry.version());
            return new ScenarioStore(scenarios);
        }
    }
}
