package com.bizsim.drg.cache;

import com.bizsim.drg.graph.EvaluationGroup;
import com.bizsim.drg.graph.EvaluationPlan;

import java.util.BitSet;

/**
 * Reverse-dependency facts about one evaluation plan, used to key and
 * invalidate group-level cache entries.
 *
 * - upstream inputs: for each group, the node indices of every input attribute
 * it transitively reads, ascending.
 * - downstream closure: for each group, the ids of every group that
 * transitively reads it.
 *
 * Both are computed in one pass each over the group ids, which are already in
 * topological order.
 */
public final class DependencyIndex {
    private final EvaluationPlan plan;
    private final int[][] upstreamInputs;
    private final BitSet[] downstream;

    private DependencyIndex(EvaluationPlan plan, int[][] upstreamInputs, BitSet[] downstream) {
        this.plan = plan;
        this.upstreamInputs = upstreamInputs;
        this.downstream = downstream;
    }

    public static DependencyIndex of(EvaluationPlan plan) {
        final int g = plan.groupCount();
        BitSet[] upstream = new BitSet[g];
        for (int id = 0; id < g; id++) {
            BitSet set = new BitSet();
            EvaluationGroup group = plan.group(id);
            if (group.isInput())
                set.set(group.firstMember());
            for (int p : plan.predecessors(id))
                set.or(upstream[p]);
            upstream[id] = set;
        }
        int[][] upstreamInputs = new int[g][];
        for (int id = 0; id < g; id++)
            upstreamInputs[id] = upstream[id].stream().toArray();

        BitSet[] downstream = new BitSet[g];
        for (int id = g - 1; id >= 0; id--) {
            BitSet set = new BitSet();
            for (int s : plan.successors(id)) {
                set.set(s);
                set.or(downstream[s]);
            }
            downstream[id] = set;
        }
        return new DependencyIndex(plan, upstreamInputs, downstream);
    }

    public EvaluationPlan plan() {
        return plan;
    }

    /** Node indices of the inputs the group transitively reads. */
    public int[] upstreamInputs(int groupId) {
        return upstreamInputs[groupId].clone();
    }

    /** Ids of the groups that transitively read the given group. */
    public BitSet downstreamGroups(int groupId) {
        return (BitSet) downstream[groupId].clone();
    }

    /**
     * Groups whose values can change when the given attribute changes: its
     * downstream closure, plus its own group when it is calculated.
     */
    public BitSet affectedGroups(String identity) {
        int node = plan.graph().index(identity);
        int groupId = plan.groupOf(node);
        BitSet affected = downstreamGroups(groupId);
        if (!plan.group(groupId).isInput())
            affected.set(groupId);
        return affected;
    }

    /** Values of the group's upstream inputs, read from a run's value array. */
    public double[] upstreamValues(int groupId, double[] nodeValues) {
        int[] inputs = upstreamInputs[groupId];
        double[] out = new double[inputs.length];
        for (int k = 0; k < inputs.length; k++)
            out[k] = nodeValues[inputs[k]];
        return out;
    }
}
