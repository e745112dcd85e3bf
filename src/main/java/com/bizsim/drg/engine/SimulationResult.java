package com.bizsim.drg.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one simulation run.
 *
 * @param modelVersion Version of the model that produced the values.
 * @param scenarioName Scenario that was evaluated.
 * @param values       Every attribute identity to its final value, in declaration order.
 * @param diagnostics  One entry per cyclic group, in plan order.
 * @param state        Terminal state: DONE or EXHAUSTED.
 * @param cacheable    False for results that depend on run history or wall-clock (warm start, deadline).
 */
public record SimulationResult(String modelVersion, String scenarioName, Map<String, Double> values,
        List<GroupDiagnostics> diagnostics, RunState state, boolean cacheable) {

    public SimulationResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Final value of an attribute.
     *
     * @throws IllegalArgumentException if the identity is not part of the model.
     */
    public double value(String identity) {
        Double v = values.get(identity);
        if (v == null)
            throw new IllegalArgumentException("Unknown attribute: " + identity);
        return v;
    }

    public boolean allConverged() {
        return diagnostics.stream().allMatch(GroupDiagnostics::converged);
    }

    public List<GroupDiagnostics> notConverged() {
        return diagnostics.stream().filter(d -> !d.converged()).toList();
    }

    /** Diagnostics of the cyclic group containing the given attribute, or null if it is not cyclic. */
    public GroupDiagnostics diagnosticsFor(String identity) {
        for (GroupDiagnostics d : diagnostics)
            if (d.members().contains(identity))
                return d;
        return null;
    }
}
