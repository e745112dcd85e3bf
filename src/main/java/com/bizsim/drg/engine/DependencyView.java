package com.bizsim.drg.engine;

import com.bizsim.drg.api.DependencySnapshot;
import com.bizsim.drg.graph.DependencyGraph;
import com.bizsim.drg.model.Attribute;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link DependencySnapshot} over a run's value array, restricted to the
 * declared dependencies of one attribute.
 *
 * Reads are live: inside a cyclic group a member sees the values other members
 * wrote earlier in the same iteration.
 */
final class DependencyView implements DependencySnapshot {
    private final double[] values;
    private final Layout layout;

    DependencyView(double[] values, Layout layout) {
        this.values = values;
        this.layout = layout;
    }

    @Override
    public double get(String name) {
        Integer position = layout.positions.get(name);
        if (position == null)
            throw new IllegalArgumentException(
                    "'" + name + "' is not a declared dependency of " + layout.owner + " " + layout.positions.keySet());
        return values[layout.indices[position]];
    }

    @Override
    public double get(int position) {
        if (position < 0 || position >= layout.indices.length)
            throw new IndexOutOfBoundsException(
                    "Dependency position " + position + " out of range for " + layout.owner + " (size "
                            + layout.indices.length + ")");
        return values[layout.indices[position]];
    }

    @Override
    public int size() {
        return layout.indices.length;
    }

    /**
     * Precomputed per-attribute lookup: node index of each declared dependency
     * and the positions of its qualified and as-declared names. Built once per
     * plan and shared by all runs.
     */
    static final class Layout {
        final String owner;
        final int[] indices;
        final Map<String, Integer> positions;

        private Layout(String owner, int[] indices, Map<String, Integer> positions) {
            this.owner = owner;
            this.indices = indices;
            this.positions = positions;
        }

        static Layout of(Attribute attribute, DependencyGraph graph) {
            int n = attribute.dependencies().size();
            int[] indices = new int[n];
            Map<String, Integer> positions = new HashMap<>();
            for (int k = 0; k < n; k++) {
                String qualified = attribute.dependencies().get(k);
                indices[k] = graph.index(qualified);
                positions.put(qualified, k);
            }
            for (int k = 0; k < n; k++)
                positions.putIfAbsent(attribute.declaredNames().get(k), k);
            return new Layout(attribute.identity(), indices, Map.copyOf(positions));
        }
    }
}
