package com.bizsim.drg.cache;

import com.bizsim.drg.engine.GroupDiagnostics;

/**
 * Immutable memo of one evaluated group: member values in member order plus,
 * for cyclic groups, the convergence diagnostics of the run that solved it.
 */
public final class CachedGroup {
    private final double[] values;
    private final GroupDiagnostics diagnostics;

    public CachedGroup(double[] values, GroupDiagnostics diagnostics) {
        this.values = values.clone();
        this.diagnostics = diagnostics;
    }

    public int size() {
        return values.length;
    }

    public double value(int k) {
        return values[k];
    }

    public double[] values() {
        return values.clone();
    }

    /** Diagnostics of the solving run, or null for a non-cyclic group. */
    public GroupDiagnostics diagnostics() {
        return diagnostics;
    }
}
