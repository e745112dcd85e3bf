package com.bizsim.drg.graph;

import java.util.List;

/**
 * Immutable result of graph analysis: groups, their levels, and the condensed
 * edges between groups.
 *
 * Levels must be processed strictly in order. Groups within one level have no
 * edges between them and may be evaluated concurrently.
 */
public final class EvaluationPlan {
    private final DependencyGraph graph;
    private final List<EvaluationGroup> groups;
    private final int[][] levels;
    private final int[] groupOf;
    private final int[][] predecessors;
    private final int[][] successors;
    private final int cyclicGroupCount;

    EvaluationPlan(DependencyGraph graph, List<EvaluationGroup> groups, int[][] levels, int[] groupOf,
            int[][] predecessors, int[][] successors) {
        this.graph = graph;
        this.groups = List.copyOf(groups);
        this.levels = levels;
        this.groupOf = groupOf;
        this.predecessors = predecessors;
        this.successors = successors;
        int cyclic = 0;
        for (EvaluationGroup g : groups)
            if (g.isCyclic())
                cyclic++;
        this.cyclicGroupCount = cyclic;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public int groupCount() {
        return groups.size();
    }

    public EvaluationGroup group(int id) {
        return groups.get(id);
    }

    /** Groups ordered by id, i.e. by (level, first member). */
    public List<EvaluationGroup> groups() {
        return groups;
    }

    public int levelCount() {
        return levels.length;
    }

    public int levelSize(int level) {
        return levels[level].length;
    }

    /** Group id of the k-th group of a level. */
    public int groupAt(int level, int k) {
        return levels[level][k];
    }

    /** Group id of the attribute at the given node index. */
    public int groupOf(int nodeIndex) {
        return groupOf[nodeIndex];
    }

    /** Ids of the groups the given group reads from. */
    public int[] predecessors(int groupId) {
        return predecessors[groupId].clone();
    }

    /** Ids of the groups that read from the given group. */
    public int[] successors(int groupId) {
        return successors[groupId].clone();
    }

    public int cyclicGroupCount() {
        return cyclicGroupCount;
    }
}
