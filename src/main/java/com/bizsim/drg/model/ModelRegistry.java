package com.bizsim.drg.model;

import com.bizsim.drg.api.AttributeKind;
import com.bizsim.drg.api.Formula;
import com.bizsim.drg.model.ModelDefinitionException.ErrorKind;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable registry of blocks and attributes for one model version.
 *
 * The registry is produced by {@link Builder#seal()}. Sealing validates the
 * whole definition once, after all blocks and attributes are loaded, so
 * attributes may reference dependencies that are declared later in the same
 * load. After sealing nothing can be added, and all reads are safe for
 * concurrent access.
 *
 * Attributes are kept in declaration order. The declaration index of an
 * attribute is also its node index in the dependency graph, and it is the
 * tie-break used to order updates within a cyclic group.
 */
public final class ModelRegistry {
    private final String modelName;
    private final String version;
    private final List<Block> blocks;
    private final List<Attribute> attributes;
    private final List<Attribute> inputs;
    private final Map<String, Attribute> byIdentity;
    private final Map<String, Block> blocksByName;

    private ModelRegistry(String modelName, String version, List<Block> blocks, List<Attribute> attributes) {
        this.modelName = modelName;
        this.version = version;
        this.blocks = List.copyOf(blocks);
        this.attributes = List.copyOf(attributes);

        Map<String, Attribute> ids = new HashMap<>(attributes.size() * 2);
        List<Attribute> in = new ArrayList<>();
        for (Attribute a : attributes) {
            ids.put(a.identity(), a);
            if (a.isInput())
                in.add(a);
        }
        Map<String, Block> bs = new HashMap<>(blocks.size() * 2);
        for (Block b : blocks)
            bs.put(b.name(), b);

        this.byIdentity = Map.copyOf(ids);
        this.inputs = List.copyOf(in);
        this.blocksByName = Map.copyOf(bs);
    }

    public static Builder builder(String modelName, String version) {
        return new Builder(modelName, version);
    }

    public String modelName() {
        return modelName;
    }

    /** Model version. Part of every cache key derived from this registry. */
    public String version() {
        return version;
    }

    /**
     * Resolves a qualified identity to its attribute.
     *
     * @throws ModelDefinitionException with UNKNOWN_ATTRIBUTE if absent.
     */
    public Attribute resolve(String identity) {
        Attribute a = byIdentity.get(identity);
        if (a == null)
            throw new ModelDefinitionException(ErrorKind.UNKNOWN_ATTRIBUTE, identity, "No such attribute");
        return a;
    }

    public Optional<Attribute> find(String identity) {
        return Optional.ofNullable(byIdentity.get(identity));
    }

    public boolean contains(String identity) {
        return byIdentity.containsKey(identity);
    }

    /** All attributes in declaration order. */
    public List<Attribute> attributes() {
        return attributes;
    }

    /** Input attributes in declaration order. */
    public List<Attribute> inputs() {
        return inputs;
    }

    public List<Block> blocks() {
        return blocks;
    }

    public Block block(String name) {
        Block b = blocksByName.get(name);
        if (b == null)
            throw new ModelDefinitionException(ErrorKind.UNKNOWN_BLOCK, name, "No such block");
        return b;
    }

    public int attributeCount() {
        return attributes.size();
    }

    @Override
    public String toString() {
        return "ModelRegistry[" + modelName + "@" + version + ", " + blocks.size() + " blocks, "
                + attributes.size() + " attributes]";
    }

    /**
     * Collects definitions and seals them into a {@link ModelRegistry}.
     * Duplicate names and kind/formula mismatches are rejected immediately;
     * dependency resolution is deferred to {@link #seal()}.
     */
    @Log4j2
    public static final class Builder {
        private final String modelName;
        private final String version;
        private final Map<String, List<String>> blockMembers = new LinkedHashMap<>();
        private final List<Attribute> attributes = new ArrayList<>();
        private final Set<String> identities = new HashSet<>();
        private ModelRegistry sealed;

        private Builder(String modelName, String version) {
            this.modelName = requireName(modelName, "model");
            this.version = Objects.requireNonNull(version, "version");
        }

        public Builder defineBlock(String name) {
            checkNotSealed();
            requireName(name, name);
            if (blockMembers.containsKey(name))
                throw new ModelDefinitionException(ErrorKind.DUPLICATE_BLOCK, name, "Block already defined");
            blockMembers.put(name, new ArrayList<>());
            return this;
        }

        /** Defines an input attribute with its default value. */
        public Builder defineInput(String block, String name, double defaultValue) {
            return defineAttribute(block, name, AttributeKind.INPUT, defaultValue, null, null);
        }

        /** Defines a calculated attribute. Pass no dependencies to declare "none". */
        public Builder defineCalculated(String block, String name, Formula formula, String... dependencies) {
            return defineAttribute(block, name, AttributeKind.CALCULATED, 0.0, formula, Arrays.asList(dependencies));
        }

        public Builder defineCalculated(String block, String name, Formula formula, List<String> dependencies) {
            return defineAttribute(block, name, AttributeKind.CALCULATED, 0.0, formula, dependencies);
        }

        /**
         * Defines an attribute.
         *
         * @param block        Owning block (must already be defined).
         * @param name         Attribute name, no dots.
         * @param kind         INPUT or CALCULATED.
         * @param defaultValue Default value for inputs; ignored for calculated attributes.
         * @param formula      Required for CALCULATED, forbidden for INPUT.
         * @param dependencies Required (possibly empty) for CALCULATED; null or empty for INPUT.
         */
        public Builder defineAttribute(String block, String name, AttributeKind kind, double defaultValue,
                Formula formula, List<String> dependencies) {
            checkNotSealed();
            Objects.requireNonNull(kind, "kind");
            List<String> members = blockMembers.get(block);
            if (members == null)
                throw new ModelDefinitionException(ErrorKind.UNKNOWN_BLOCK, String.valueOf(block),
                        "Attribute '" + name + "' declared in undefined block");
            String identity = Attribute.qualify(block, requireName(name, block + "." + name));
            if (identities.contains(identity))
                throw new ModelDefinitionException(ErrorKind.DUPLICATE_ATTRIBUTE, identity,
                        "Attribute already defined");

            List<String> qualified = new ArrayList<>();
            List<String> declared = new ArrayList<>();
            if (kind == AttributeKind.INPUT) {
                if (formula != null)
                    fail(identity, ErrorKind.UNEXPECTED_FORMULA, "Input attributes cannot carry a formula");
                if (dependencies != null && !dependencies.isEmpty())
                    fail(identity, ErrorKind.UNEXPECTED_DEPENDENCIES, "Input attributes cannot declare dependencies");
                if (!Double.isFinite(defaultValue))
                    fail(identity, ErrorKind.INVALID_VALUE, "Default value must be finite, got " + defaultValue);
            } else {
                if (formula == null)
                    fail(identity, ErrorKind.MISSING_FORMULA, "Calculated attributes need exactly one formula");
                if (dependencies == null)
                    fail(identity, ErrorKind.MISSING_DEPENDENCIES,
                            "Calculated attributes must declare their dependencies (an empty list is allowed)");
                for (String ref : dependencies) {
                    if (ref == null || ref.isBlank())
                        fail(identity, ErrorKind.UNKNOWN_DEPENDENCY, "Blank dependency reference");
                    String q = Attribute.qualifyReference(block, ref);
                    if (qualified.contains(q))
                        continue;
                    qualified.add(q);
                    declared.add(ref);
                }
                defaultValue = 0.0;
            }

            // Registered only once every check passed, so a rejected definition can be retried.
            identities.add(identity);
            Attribute attribute = new Attribute(block, name, kind, defaultValue, formula, qualified, declared,
                    attributes.size());
            attributes.add(attribute);
            members.add(identity);
            log.trace("Defined {} with dependencies {}", attribute, qualified);
            return this;
        }

        /**
         * Validates all dependency references and returns the immutable registry.
         * Subsequent calls return the same instance.
         *
         * @throws ModelDefinitionException with UNKNOWN_DEPENDENCY on a dangling reference.
         */
        public ModelRegistry seal() {
            if (sealed != null)
                return sealed;
            for (Attribute a : attributes) {
                for (String dep : a.dependencies()) {
                    if (!identities.contains(dep))
                        throw new ModelDefinitionException(ErrorKind.UNKNOWN_DEPENDENCY, a.identity(),
                                "Dependency '" + dep + "' does not exist");
                }
            }
            List<Block> blocks = new ArrayList<>(blockMembers.size());
            blockMembers.forEach((name, members) -> blocks.add(new Block(name, members)));
            sealed = new ModelRegistry(modelName, version, blocks, attributes);
            log.debug("Sealed {}", sealed);
            return sealed;
        }

        public boolean isSealed() {
            return sealed != null;
        }

        private void checkNotSealed() {
            if (sealed != null)
                throw new IllegalStateException("Model registry " + modelName + "@" + version + " is sealed");
        }

        private static void fail(String identity, ErrorKind kind, String message) {
            throw new ModelDefinitionException(kind, identity, message);
        }

        private static String requireName(String name, String context) {
            if (name == null || name.isBlank() || name.indexOf('.') >= 0)
                throw new ModelDefinitionException(ErrorKind.INVALID_NAME, String.valueOf(context),
                        "Names must be non-blank and must not contain '.': '" + name + "'");
            return name;
        }
    }
}
