package com.bizsim.drg.wiring;

/**
 * Mutable ring-buffer slot carrying one input update.
 *
 * Instances are pre-allocated by the Disruptor and reused for every update,
 * so publishing allocates nothing.
 *
 * Fields:
 * - inputIndex: declaration index of the target input attribute.
 * - value: the new value.
 * - batchEnd: forces a run right after this event even if more are queued.
 */
public final class InputUpdateEvent {
    private int inputIndex = -1;
    private double value;
    private boolean batchEnd;
    private long sequenceId;

    public void set(int inputIndex, double value, boolean batchEnd, long sequenceId) {
        this.inputIndex = inputIndex;
        this.value = value;
        this.batchEnd = batchEnd;
        this.sequenceId = sequenceId;
    }

    public int inputIndex() {
        return inputIndex;
    }

    public double value() {
        return value;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        inputIndex = -1;
        value = 0;
        batchEnd = false;
        sequenceId = 0;
    }
}
