package com.bizsim.drg.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a model file: blocks of attributes plus named
 * scenarios.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelDefinition {
    private ModelInfo model;

    /** Model name, version, blocks and scenarios. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ModelInfo {
        private String name, version, description;
        private List<BlockDef> blocks;
        private List<ScenarioDef> scenarios;
    }

    /** A named group of attributes. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BlockDef {
        private String name;
        private List<AttributeDef> attributes;
    }

    /**
     * One attribute. Inputs carry {@code value}; calculated attributes carry
     * {@code formula}, {@code dependencies} and optional {@code properties}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class AttributeDef {
        private String name, kind, formula, description;
        private Double value;
        private List<String> dependencies;
        private Map<String, Object> properties;
    }

    /** Input overrides grouped by block: {@code {"Production": {"energyCost": 90}}}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ScenarioDef {
        private String name;
        private Map<String, Map<String, Double>> overrides;
    }
}
