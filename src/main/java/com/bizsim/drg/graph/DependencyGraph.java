package com.bizsim.drg.graph;

import com.bizsim.drg.model.Attribute;

import java.util.*;

/**
 * CSR-encoded directed dependency graph over attribute identities.
 *
 * One node per attribute; node index = declaration index in the registry.
 * Edges run dependency -> dependent. Unlike an acyclic topology this graph may
 * contain cycles and self-loops; the {@link GraphAnalyzer} collapses them into
 * groups.
 *
 * Data layout (Compressed Sparse Row, both directions):
 * - childrenOffset / childrenList: dependents of node i are
 * childrenList[childrenOffset[i] .. childrenOffset[i+1]).
 * - parentOffset / parentList: dependencies of node i, in declaration order,
 * are parentList[parentOffset[i] .. parentOffset[i+1]).
 *
 * Iterating contiguous int arrays keeps traversal allocation-free, which
 * matters for the per-iteration work of the fixed-point solver.
 */
public final class DependencyGraph {
    private final Attribute[] nodes;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentOffset;
    private final int[] parentList;
    private final BitSet selfLoops;
    private final Map<String, Integer> nameToIndex;

    private DependencyGraph(Attribute[] nodes, int[] childrenOffset, int[] childrenList, int[] parentOffset,
            int[] parentList, BitSet selfLoops, Map<String, Integer> nameToIndex) {
        this.nodes = nodes;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentOffset = parentOffset;
        this.parentList = parentList;
        this.selfLoops = selfLoops;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return nodes.length;
    }

    public int edgeCount() {
        return childrenList.length;
    }

    /** Returns the attribute at the given node index. */
    public Attribute attribute(int i) {
        return nodes[i];
    }

    /** Resolves an identity to its node index. O(1) hash lookup. */
    public int index(String identity) {
        Integer idx = nameToIndex.get(identity);
        if (idx == null)
            throw new IllegalArgumentException("Unknown attribute: " + identity);
        return idx;
    }

    public boolean isInput(int i) {
        return nodes[i].isInput();
    }

    public boolean hasSelfLoop(int i) {
        return selfLoops.get(i);
    }

    public int childCount(int i) {
        return childrenOffset[i + 1] - childrenOffset[i];
    }

    public int child(int i, int k) {
        return childrenList[childrenOffset[i] + k];
    }

    public int childrenStart(int i) {
        return childrenOffset[i];
    }

    public int childrenEnd(int i) {
        return childrenOffset[i + 1];
    }

    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public int parentCount(int i) {
        return parentOffset[i + 1] - parentOffset[i];
    }

    /** The k-th declared dependency of node i. */
    public int parent(int i, int k) {
        return parentList[parentOffset[i] + k];
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates nodes and edges and compiles them into CSR arrays.
     * Self-edges are kept; they mark a single-node cycle.
     */
    public static final class Builder {
        private final List<Attribute> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();
        private final List<List<Integer>> backwardEdges = new ArrayList<>();
        private final BitSet selfLoops = new BitSet();

        public Builder addNode(Attribute attribute) {
            if (nameToIdx.containsKey(attribute.identity()))
                throw new IllegalArgumentException("Duplicate node: " + attribute.identity());
            int idx = nodes.size();
            nodes.add(attribute);
            nameToIdx.put(attribute.identity(), idx);
            forwardEdges.add(new ArrayList<>());
            backwardEdges.add(new ArrayList<>());
            return this;
        }

        /** Adds the edge dependency -> dependent. */
        public Builder addEdge(String dependency, String dependent) {
            int from = requireIndex(dependency);
            int to = requireIndex(dependent);
            if (from == to)
                selfLoops.set(from);
            forwardEdges.get(from).add(to);
            backwardEdges.get(to).add(from);
            return this;
        }

        public boolean contains(String identity) {
            return nameToIdx.containsKey(identity);
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return idx;
        }

        public DependencyGraph build() {
            int n = nodes.size();
            int[] childOffsets = new int[n + 1];
            int[] parentOffsets = new int[n + 1];
            for (int i = 0; i < n; i++) {
                childOffsets[i + 1] = childOffsets[i] + forwardEdges.get(i).size();
                parentOffsets[i + 1] = parentOffsets[i] + backwardEdges.get(i).size();
            }
            int[] children = new int[childOffsets[n]];
            int[] parents = new int[parentOffsets[n]];
            for (int i = 0; i < n; i++) {
                // Dependents sorted for a deterministic traversal; dependencies stay in declaration order.
                List<Integer> kids = new ArrayList<>(forwardEdges.get(i));
                Collections.sort(kids);
                for (int k = 0; k < kids.size(); k++)
                    children[childOffsets[i] + k] = kids.get(k);
                List<Integer> deps = backwardEdges.get(i);
                for (int k = 0; k < deps.size(); k++)
                    parents[parentOffsets[i] + k] = deps.get(k);
            }
            return new DependencyGraph(nodes.toArray(new Attribute[0]), childOffsets, children, parentOffsets,
                    parents, (BitSet) selfLoops.clone(), Map.copyOf(nameToIdx));
        }
    }
}
