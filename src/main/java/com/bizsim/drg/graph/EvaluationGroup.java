package com.bizsim.drg.graph;

import java.util.List;

/**
 * One node of the condensed graph: a single attribute or a cyclic SCC.
 *
 * Members are sorted by declaration index, which is the fixed update order of
 * the fixed-point solver.
 */
public final class EvaluationGroup {
    private final int id;
    private final int level;
    private final int[] members;
    private final List<String> identities;
    private final boolean cyclic;
    private final boolean input;

    EvaluationGroup(int id, int level, int[] members, List<String> identities, boolean cyclic, boolean input) {
        this.id = id;
        this.level = level;
        this.members = members;
        this.identities = List.copyOf(identities);
        this.cyclic = cyclic;
        this.input = input;
    }

    public int id() {
        return id;
    }

    public int level() {
        return level;
    }

    public int memberCount() {
        return members.length;
    }

    /** Node index of the k-th member. */
    public int member(int k) {
        return members[k];
    }

    /** Lowest declaration index among the members. */
    public int firstMember() {
        return members[0];
    }

    /** Qualified member identities in update order. */
    public List<String> identities() {
        return identities;
    }

    /** True for SCCs with more than one member or a self-loop. */
    public boolean isCyclic() {
        return cyclic;
    }

    /** True if the group is a single input attribute (bound, never evaluated). */
    public boolean isInput() {
        return input;
    }

    @Override
    public String toString() {
        return "Group#" + id + "[L" + level + (cyclic ? ", cyclic" : "") + "] " + identities;
    }
}
