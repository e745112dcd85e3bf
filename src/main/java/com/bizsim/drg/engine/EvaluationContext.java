package com.bizsim.drg.engine;

import com.bizsim.drg.api.EvaluationListener;
import com.bizsim.drg.graph.DependencyGraph;
import com.bizsim.drg.graph.EvaluationGroup;
import com.bizsim.drg.model.Attribute;

/**
 * Per-run working state: the value of every attribute and the run's state
 * machine.
 *
 * Owned by exactly one run and discarded when it ends. Worker threads of one
 * level write disjoint node indices; the level barrier publishes their writes
 * to the next level.
 */
final class EvaluationContext {
    private final long runId;
    private final String scenarioName;
    private final DependencyGraph graph;
    private final DependencyView.Layout[] layouts;
    private final EvaluationListener listener;
    private final double[] values;
    private volatile RunState state = RunState.INITIALIZING;

    EvaluationContext(long runId, String scenarioName, DependencyGraph graph, DependencyView.Layout[] layouts,
            EvaluationListener listener) {
        this.runId = runId;
        this.scenarioName = scenarioName;
        this.graph = graph;
        this.layouts = layouts;
        this.listener = listener;
        this.values = new double[graph.nodeCount()];
    }

    long runId() {
        return runId;
    }

    String scenarioName() {
        return scenarioName;
    }

    RunState state() {
        return state;
    }

    /**
     * Moves the state machine.
     *
     * @throws IllegalStateException on a transition the state machine does not allow.
     */
    void transition(RunState next) {
        RunState from = state;
        if (!from.canTransitionTo(next))
            throw new IllegalStateException("Run " + runId + ": illegal transition " + from + " -> " + next);
        state = next;
        listener.onStateChange(runId, from, next);
    }

    double get(int node) {
        return values[node];
    }

    void set(int node, double value) {
        values[node] = value;
    }

    /** The live value array, for reading upstream inputs. */
    double[] values() {
        return values;
    }

    double[] memberValues(EvaluationGroup group) {
        double[] out = new double[group.memberCount()];
        for (int k = 0; k < out.length; k++)
            out[k] = values[group.member(k)];
        return out;
    }

    /**
     * Applies the attribute's formula to its dependency view and stores the
     * result.
     *
     * @param iteration Solver iteration (1-based), or 0 outside cyclic groups.
     * @throws FormulaEvaluationException if the formula throws or returns a non-finite value.
     */
    double evaluate(int node, int iteration) {
        Attribute attribute = graph.attribute(node);
        long start = System.nanoTime();
        double v;
        try {
            v = attribute.formula().evaluate(new DependencyView(values, layouts[node]));
        } catch (RuntimeException e) {
            listener.onAttributeError(runId, attribute.identity(), e);
            throw new FormulaEvaluationException(attribute.identity(), iteration, String.valueOf(e.getMessage()), e);
        }
        if (!Double.isFinite(v)) {
            FormulaEvaluationException e = new FormulaEvaluationException(attribute.identity(), iteration,
                    "non-finite result " + v, null);
            listener.onAttributeError(runId, attribute.identity(), e);
            throw e;
        }
        values[node] = v;
        listener.onAttributeEvaluated(runId, attribute.identity(), v, System.nanoTime() - start);
        return v;
    }
}
