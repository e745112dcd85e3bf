package com.bizsim.drg.util;

import com.bizsim.drg.engine.GroupDiagnostics;
import com.bizsim.drg.engine.SimulationResult;
import com.bizsim.drg.graph.DependencyGraph;
import com.bizsim.drg.graph.EvaluationGroup;
import com.bizsim.drg.graph.EvaluationPlan;
import com.bizsim.drg.model.Attribute;

import java.util.Map;

/**
 * Text diagnostics for an analysed model.
 *
 * <p>
 * <b>Usage:</b> debugging sessions and log output. Allocates strings freely;
 * keep it off the evaluation path.
 */
public final class ModelExplain {
    private final EvaluationPlan plan;
    private final DependencyGraph graph;

    public ModelExplain(EvaluationPlan plan) {
        this.plan = plan;
        this.graph = plan.graph();
    }

    /**
     * Describes one attribute: kind, group, level, dependencies and dependents.
     */
    public String explainAttribute(String identity) {
        int idx = graph.index(identity);
        Attribute a = graph.attribute(idx);
        EvaluationGroup g = plan.group(plan.groupOf(idx));
        StringBuilder sb = new StringBuilder(256);
        sb.append("Attribute: ").append(identity).append('\n')
                .append("  Kind: ").append(a.kind()).append('\n')
                .append("  Declaration index: ").append(idx).append('\n')
                .append("  Group: ").append(g.id()).append(g.isCyclic() ? " (cyclic)" : "").append('\n')
                .append("  Level: ").append(g.level()).append('\n');
        if (a.isInput())
            sb.append("  Default: ").append(a.defaultValue()).append('\n');
        sb.append("  Depends on (").append(a.dependencies().size()).append("): ")
                .append(String.join(", ", a.dependencies())).append('\n');
        int cc = graph.childCount(idx);
        sb.append("  Read by (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(graph.attribute(graph.child(idx, i)).identity());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * Dumps the plan level by level; cyclic groups are marked with their
     * update order.
     */
    public String dumpPlan() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Plan (").append(graph.nodeCount()).append(" attributes, ").append(plan.groupCount())
                .append(" groups, ").append(plan.cyclicGroupCount()).append(" cyclic, ").append(plan.levelCount())
                .append(" levels):\n");
        for (int l = 0; l < plan.levelCount(); l++) {
            sb.append("  Level ").append(l).append(":\n");
            for (int k = 0; k < plan.levelSize(l); k++) {
                EvaluationGroup g = plan.group(plan.groupAt(l, k));
                sb.append("    [").append(g.id()).append("] ");
                if (g.isCyclic())
                    sb.append("CYCLE ").append(String.join(" -> ", g.identities()));
                else
                    sb.append(g.identities().get(0)).append(g.isInput() ? " (IN)" : "");
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /** Values and convergence diagnostics of a result. */
    public static String explainResult(SimulationResult result) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Scenario '").append(result.scenarioName()).append("' @ ").append(result.modelVersion())
                .append(": ").append(result.state()).append('\n');
        for (Map.Entry<String, Double> e : result.values().entrySet())
            sb.append(String.format("  %-32s %14.6f%n", e.getKey(), e.getValue()));
        for (GroupDiagnostics d : result.diagnostics()) {
            sb.append(String.format("  group %d %s: %s, %d iterations, maxDelta=%.3g%s%n", d.groupId(), d.members(),
                    d.termination(), d.iterations(), d.maxDelta(), d.reused() ? " (reused)" : ""));
        }
        return sb.toString();
    }
}
