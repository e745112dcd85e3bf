package com.bizsim.drg.util;

import com.bizsim.drg.api.EvaluationListener;
import com.bizsim.drg.engine.GroupDiagnostics;
import com.bizsim.drg.engine.RunState;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link EvaluationListener}s.
 *
 * The listener array is copied on write and read without locking, so
 * registering a listener while runs are in flight is safe; a run already in
 * progress may or may not see the new listener.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private volatile EvaluationListener[] listeners = new EvaluationListener[0];

    public synchronized void add(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized boolean remove(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                EvaluationListener[] next = new EvaluationListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(long runId, String scenario) {
        for (EvaluationListener l : listeners)
            l.onRunStart(runId, scenario);
    }

    @Override
    public void onStateChange(long runId, RunState from, RunState to) {
        for (EvaluationListener l : listeners)
            l.onStateChange(runId, from, to);
    }

    @Override
    public void onAttributeEvaluated(long runId, String identity, double value, long durationNanos) {
        for (EvaluationListener l : listeners)
            l.onAttributeEvaluated(runId, identity, value, durationNanos);
    }

    @Override
    public void onIteration(long runId, int groupId, int iteration, double maxDelta) {
        for (EvaluationListener l : listeners)
            l.onIteration(runId, groupId, iteration, maxDelta);
    }

    @Override
    public void onGroupSolved(long runId, GroupDiagnostics diagnostics) {
        for (EvaluationListener l : listeners)
            l.onGroupSolved(runId, diagnostics);
    }

    @Override
    public void onAttributeError(long runId, String identity, Throwable error) {
        for (EvaluationListener l : listeners)
            l.onAttributeError(runId, identity, error);
    }

    @Override
    public void onRunEnd(long runId, RunState finalState) {
        for (EvaluationListener l : listeners)
            l.onRunEnd(runId, finalState);
    }
}
