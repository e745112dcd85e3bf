package com.bizsim.drg.util;

import com.bizsim.drg.api.EvaluationListener;
import com.bizsim.drg.engine.GroupDiagnostics;
import com.bizsim.drg.engine.RunState;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Aggregates run and per-attribute statistics.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Runs:</b> count per terminal state and run latency.</li>
 * <li><b>Solver:</b> total iterations and groups that did not converge.</li>
 * <li><b>Attributes:</b> evaluation count and time per attribute.</li>
 * </ul>
 *
 * <p>
 * Thread-safe: callbacks of one level arrive from several worker threads.
 */
public final class RunStatisticsListener implements EvaluationListener {

    /** Per-attribute counters. */
    public static final class AttributeStats {
        private final String identity;
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong maxNanos = new AtomicLong();

        AttributeStats(String identity) {
            this.identity = identity;
        }

        void update(long durationNanos) {
            count.increment();
            totalNanos.add(durationNanos);
            maxNanos.accumulateAndGet(durationNanos, Math::max);
        }

        public String identity() {
            return identity;
        }

        public long count() {
            return count.sum();
        }

        public double avgMicros() {
            long c = count.sum();
            return c == 0 ? 0 : totalNanos.sum() / (double) c / 1000.0;
        }

        public double maxMicros() {
            return maxNanos.get() / 1000.0;
        }
    }

    private final Map<String, AttributeStats> attributes = new ConcurrentHashMap<>();
    private final Map<Long, Long> runStarts = new ConcurrentHashMap<>();
    private final Map<RunState, LongAdder> runsByState = new EnumMap<>(RunState.class);
    private final LongAdder runsStarted = new LongAdder();
    private final LongAdder iterations = new LongAdder();
    private final LongAdder groupsSolved = new LongAdder();
    private final LongAdder groupsNotConverged = new LongAdder();
    private final LongAdder formulaErrors = new LongAdder();
    private final LongAdder totalRunNanos = new LongAdder();

    public RunStatisticsListener() {
        for (RunState s : RunState.values())
            runsByState.put(s, new LongAdder());
    }

    @Override
    public void onRunStart(long runId, String scenario) {
        runsStarted.increment();
        runStarts.put(runId, System.nanoTime());
    }

    @Override
    public void onAttributeEvaluated(long runId, String identity, double value, long durationNanos) {
        attributes.computeIfAbsent(identity, AttributeStats::new).update(durationNanos);
    }

    @Override
    public void onIteration(long runId, int groupId, int iteration, double maxDelta) {
        iterations.increment();
    }

    @Override
    public void onGroupSolved(long runId, GroupDiagnostics diagnostics) {
        groupsSolved.increment();
        if (!diagnostics.converged())
            groupsNotConverged.increment();
    }

    @Override
    public void onAttributeError(long runId, String identity, Throwable error) {
        formulaErrors.increment();
    }

    @Override
    public void onRunEnd(long runId, RunState finalState) {
        runsByState.get(finalState).increment();
        Long start = runStarts.remove(runId);
        if (start != null)
            totalRunNanos.add(System.nanoTime() - start);
    }

    public long runsStarted() {
        return runsStarted.sum();
    }

    public long runs(RunState finalState) {
        return runsByState.get(finalState).sum();
    }

    public long totalIterations() {
        return iterations.sum();
    }

    public long groupsSolved() {
        return groupsSolved.sum();
    }

    public long groupsNotConverged() {
        return groupsNotConverged.sum();
    }

    public long formulaErrors() {
        return formulaErrors.sum();
    }

    /** Evaluations of one attribute across all runs; 0 if never evaluated. */
    public long evaluations(String identity) {
        AttributeStats s = attributes.get(identity);
        return s == null ? 0 : s.count();
    }

    public double avgRunMicros() {
        long finished = 0;
        for (LongAdder a : runsByState.values())
            finished += a.sum();
        return finished == 0 ? 0 : totalRunNanos.sum() / (double) finished / 1000.0;
    }

    public void reset() {
        attributes.clear();
        runStarts.clear();
        runsByState.values().forEach(LongAdder::reset);
        runsStarted.reset();
        iterations.reset();
        groupsSolved.reset();
        groupsNotConverged.reset();
        formulaErrors.reset();
        totalRunNanos.reset();
    }

    /** Formatted table of attribute statistics, most expensive first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Runs: %d started, %d done, %d exhausted, %d failed, %d cancelled, avg %.2f us%n",
                runsStarted(), runs(RunState.DONE), runs(RunState.EXHAUSTED), runs(RunState.FAILED),
                runs(RunState.CANCELLED), avgRunMicros()));
        sb.append(String.format("Solver: %d groups, %d not converged, %d iterations%n", groupsSolved(),
                groupsNotConverged(), totalIterations()));
        sb.append(String.format("%-36s | %10s | %10s | %10s%n", "Attribute", "Count", "Avg (us)", "Max (us)"));
        sb.append("---------------------------------------------------------------------------\n");
        AttributeStats[] stats = attributes.values().toArray(new AttributeStats[0]);
        Arrays.sort(stats, (a, b) -> Double.compare(b.avgMicros() * b.count(), a.avgMicros() * a.count()));
        for (AttributeStats s : stats)
            sb.append(String.format("%-36s | %10d | %10.2f | %10.2f%n", s.identity(), s.count(), s.avgMicros(),
                    s.maxMicros()));
        return sb.toString();
    }
}
