package com.bizsim.drg.io;

import com.bizsim.drg.api.AttributeKind;
import com.bizsim.drg.api.Formula;
import com.bizsim.drg.model.ModelDefinitionException;
import com.bizsim.drg.model.ModelDefinitionException.ErrorKind;
import com.bizsim.drg.model.ModelRegistry;
import com.bizsim.drg.model.Scenario;
import com.bizsim.drg.model.ScenarioStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles JSON model files into a sealed {@link ModelRegistry} and
 * {@link ScenarioStore}.
 *
 * Steps:
 * 1. Parse: Jackson binds the file to {@link ModelDefinition}.
 * 2. Blocks: every block is defined before any attribute, so dependencies may
 * point forward and across blocks.
 * 3. Attributes: inputs take {@code value}; calculated attributes get their
 * formula from the {@link FormulaRegistry} by type name.
 * 4. Seal: dependency references are validated, then scenarios are checked
 * against the sealed registry.
 *
 * All definition problems surface as {@link ModelDefinitionException}.
 */
public final class JsonModelLoader {
    private static final Logger log = LogManager.getLogger(JsonModelLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FormulaRegistry formulas;

    public JsonModelLoader() {
        this(new FormulaRegistry());
    }

    public JsonModelLoader(FormulaRegistry formulas) {
        this.formulas = formulas;
    }

    public FormulaRegistry formulas() {
        return formulas;
    }

    // ── Parsing ────────────────────────────────────────────────────────

    public static ModelDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, ModelDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed model JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static ModelDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static ModelDefinition parseResource(String resource) {
        try (InputStream in = JsonModelLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Model resource not found on classpath: " + resource);
            return MAPPER.readValue(in, ModelDefinition.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load model definition from " + resource, e);
        }
    }

    // ── Loading ────────────────────────────────────────────────────────

    public LoadedModel load(String json) {
        return compile(parse(json));
    }

    public LoadedModel load(Path path) throws IOException {
        return compile(parseFile(path));
    }

    public LoadedModel loadResource(String resource) {
        return compile(parseResource(resource));
    }

    public LoadedModel compile(ModelDefinition definition) {
        ModelDefinition.ModelInfo info = definition.getModel();
        if (info == null)
            throw new IllegalArgumentException("Missing 'model' key");
        if (info.getName() == null || info.getVersion() == null)
            throw new ModelDefinitionException(ErrorKind.INVALID_NAME, String.valueOf(info.getName()),
                    "Model needs a name and a version");

        ModelRegistry.Builder builder = ModelRegistry.builder(info.getName(), info.getVersion());
        List<ModelDefinition.BlockDef> blocks = info.getBlocks() != null ? info.getBlocks() : List.of();
        for (ModelDefinition.BlockDef b : blocks)
            builder.defineBlock(b.getName());
        for (ModelDefinition.BlockDef b : blocks) {
            if (b.getAttributes() == null)
                continue;
            for (ModelDefinition.AttributeDef a : b.getAttributes())
                defineAttribute(builder, b.getName(), a);
        }
        ModelRegistry registry = builder.seal();

        ScenarioStore.Builder scenarios = ScenarioStore.builder();
        if (info.getScenarios() != null) {
            for (ModelDefinition.ScenarioDef s : info.getScenarios()) {
                if (s.getName() == null || s.getName().isBlank())
                    throw new ModelDefinitionException(ErrorKind.INVALID_NAME, String.valueOf(s.getName()),
                            "Scenario needs a name");
                Map<String, Map<String, Double>> overrides = s.getOverrides() != null ? s.getOverrides() : Map.of();
                scenarios.defineScenario(Scenario.ofBlocks(s.getName(), overrides));
            }
        }
        ScenarioStore store = scenarios.seal(registry);
        log.info("Loaded model {}@{}: {} blocks, {} attributes, {} scenarios", registry.modelName(),
                registry.version(), registry.blocks().size(), registry.attributeCount(),
                store.scenarioNames().size());
        return new LoadedModel(registry, store);
    }

    private void defineAttribute(ModelRegistry.Builder builder, String block, ModelDefinition.AttributeDef a) {
        String identity = block + "." + a.getName();
        AttributeKind kind;
        try {
            kind = AttributeKind.fromString(a.getKind());
        } catch (IllegalArgumentException e) {
            throw new ModelDefinitionException(ErrorKind.INVALID_VALUE, identity,
                    "Unknown attribute kind '" + a.getKind() + "' (expected input or calculated)");
        }

        if (kind == AttributeKind.INPUT) {
            if (a.getFormula() != null)
                throw new ModelDefinitionException(ErrorKind.UNEXPECTED_FORMULA, identity,
                        "Input attributes cannot carry a formula");
            if (a.getValue() == null)
                throw new ModelDefinitionException(ErrorKind.INVALID_VALUE, identity,
                        "Input attributes need a 'value'");
            builder.defineAttribute(block, a.getName(), kind, a.getValue(), null, a.getDependencies());
            return;
        }

        if (a.getFormula() == null)
            throw new ModelDefinitionException(ErrorKind.MISSING_FORMULA, identity,
                    "Calculated attributes need a 'formula'");
        if (a.getDependencies() == null)
            throw new ModelDefinitionException(ErrorKind.MISSING_DEPENDENCIES, identity,
                    "Calculated attributes must list their 'dependencies' (an empty list is allowed)");
        Formula formula = formulas.create(a.getFormula(), identity, a.getProperties(), a.getDependencies().size());
        builder.defineAttribute(block, a.getName(), kind, 0.0, formula, a.getDependencies());
    }

    /** Serializer shared with the HTTP layer. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
