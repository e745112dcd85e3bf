package com.bizsim.drg.graph;

import com.bizsim.drg.model.Attribute;
import com.bizsim.drg.model.ModelDefinitionException;
import com.bizsim.drg.model.ModelDefinitionException.ErrorKind;
import com.bizsim.drg.model.ModelRegistry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns the declared dependencies of a sealed {@link ModelRegistry} into a
 * {@link DependencyGraph}.
 *
 * Dependency references were already validated when the registry was sealed;
 * they are checked again here so a graph can never be built with a dangling
 * edge. Self-dependencies are kept as self-loops and end up as single-member
 * cyclic groups.
 */
public final class DependencyGraphBuilder {
    private static final Logger log = LogManager.getLogger(DependencyGraphBuilder.class);

    private DependencyGraphBuilder() {
        // Utility class
    }

    public static DependencyGraph build(ModelRegistry registry) {
        DependencyGraph.Builder builder = DependencyGraph.builder();
        for (Attribute a : registry.attributes())
            builder.addNode(a);

        for (Attribute a : registry.attributes()) {
            for (String dep : a.dependencies()) {
                if (!builder.contains(dep))
                    throw new ModelDefinitionException(ErrorKind.UNKNOWN_DEPENDENCY, a.identity(),
                            "Dependency '" + dep + "' does not exist");
                builder.addEdge(dep, a.identity());
            }
        }
        DependencyGraph graph = builder.build();
        log.debug("Built dependency graph for {}@{}: {} nodes, {} edges", registry.modelName(),
                registry.version(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }
}
