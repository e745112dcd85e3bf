package com.bizsim.drg.cache;

import com.bizsim.drg.engine.RunOptions;

import java.util.Arrays;
import java.util.Objects;

/**
 * Group-level cache key: a group's values depend only on the inputs upstream
 * of it and on the solver options.
 */
public final class GroupKey {
    private final String modelVersion;
    private final int groupId;
    private final long[] inputBits;
    private final int maxIterations;
    private final long thresholdBits;
    private final int hash;

    public GroupKey(String modelVersion, int groupId, double[] upstreamInputValues, RunOptions options) {
        this.modelVersion = Objects.requireNonNull(modelVersion);
        this.groupId = groupId;
        this.inputBits = new long[upstreamInputValues.length];
        for (int i = 0; i < inputBits.length; i++)
            inputBits[i] = Double.doubleToLongBits(upstreamInputValues[i]);
        this.maxIterations = options.maxIterations();
        this.thresholdBits = Double.doubleToLongBits(options.threshold());
        int h = modelVersion.hashCode();
        h = 31 * h + groupId;
        h = 31 * h + Arrays.hashCode(inputBits);
        h = 31 * h + maxIterations;
        h = 31 * h + Long.hashCode(thresholdBits);
        this.hash = h;
    }

    public String modelVersion() {
        return modelVersion;
    }

    public int groupId() {
        return groupId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GroupKey k))
            return false;
        return hash == k.hash && groupId == k.groupId && maxIterations == k.maxIterations
                && thresholdBits == k.thresholdBits && modelVersion.equals(k.modelVersion)
                && Arrays.equals(inputBits, k.inputBits);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "GroupKey[" + modelVersion + "#" + groupId + ", inputs=" + inputBits.length + "]";
    }
}
