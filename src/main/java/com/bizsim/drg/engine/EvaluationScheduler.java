package com.bizsim.drg.engine;

import com.bizsim.drg.api.EvaluationListener;
import com.bizsim.drg.cache.CacheManager;
import com.bizsim.drg.cache.CachedGroup;
import com.bizsim.drg.cache.DependencyIndex;
import com.bizsim.drg.cache.GroupKey;
import com.bizsim.drg.graph.DependencyGraph;
import com.bizsim.drg.graph.EvaluationGroup;
import com.bizsim.drg.graph.EvaluationPlan;
import com.bizsim.drg.model.Attribute;
import com.bizsim.drg.model.ResolvedInputs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives one run over an {@link EvaluationPlan}.
 *
 * Algorithm Details:
 *
 * 1. Bind: every input attribute gets its resolved value.
 *
 * 2. Levels: processed strictly in order with a barrier between them. The
 * groups of one level share no edges, so they are handed to the worker pool
 * together and the scheduler waits for all of them before moving on. A level
 * with one group, or an engine without a pool, runs inline.
 *
 * 3. Groups: before evaluating a group the scheduler looks up the group cache
 * under (model version, group, upstream input values, options). On a hit the
 * memoised values are copied in and no formula runs. Otherwise a plain
 * attribute evaluates its formula once, and a cyclic group goes through the
 * {@link FixedPointSolver}.
 *
 * 4. Finish: DONE if every cyclic group converged and the deadline held, else
 * EXHAUSTED. Group memos are written only now, and only for cacheable runs, so
 * failed, cancelled, warm-started or deadline-truncated runs leave the cache as
 * they found it.
 *
 * Deadline:
 * Checked before each level and by the solver between iterations. Past it,
 * plain attributes of the remaining levels still evaluate once so every value
 * is present; cyclic groups stop after their first iteration.
 *
 * Fail Fast:
 * A formula error moves the run to FAILED and propagates as
 * {@link FormulaEvaluationException}; cancellation moves it to CANCELLED and
 * propagates as {@link RunCancelledException}. The scheduler itself holds no
 * per-run state, so one failed run never affects the next.
 */
public final class EvaluationScheduler {
    private static final Logger log = LogManager.getLogger(EvaluationScheduler.class);

    private final String modelVersion;
    private final EvaluationPlan plan;
    private final DependencyIndex index;
    private final CacheManager cache;
    private final ExecutorService workers;
    private final EvaluationListener listener;
    private final FixedPointSolver solver;
    private final DependencyView.Layout[] layouts;

    /**
     * @param workers Pool for concurrent groups of one level; null evaluates everything on the calling thread.
     */
    public EvaluationScheduler(String modelVersion, EvaluationPlan plan, DependencyIndex index, CacheManager cache,
            ExecutorService workers, EvaluationListener listener) {
        this.modelVersion = modelVersion;
        this.plan = plan;
        this.index = index;
        this.cache = cache;
        this.workers = workers;
        this.listener = listener;
        this.solver = new FixedPointSolver(listener);

        DependencyGraph graph = plan.graph();
        this.layouts = new DependencyView.Layout[graph.nodeCount()];
        for (int i = 0; i < layouts.length; i++) {
            Attribute a = graph.attribute(i);
            if (a.isCalculated())
                layouts[i] = DependencyView.Layout.of(a, graph);
        }
    }

    /** Result of evaluating one group: diagnostics for cyclic groups, and the memo to store on success. */
    private record GroupOutcome(GroupDiagnostics diagnostics, GroupKey key, CachedGroup memo) {
    }

    /**
     * Runs the plan for the given inputs.
     *
     * @throws FormulaEvaluationException if a formula fails.
     * @throws RunCancelledException      if the token is cancelled.
     */
    public SimulationResult execute(long runId, ResolvedInputs inputs, RunOptions options, CancellationToken token) {
        final DependencyGraph graph = plan.graph();
        EvaluationContext ctx = new EvaluationContext(runId, inputs.scenarioName(), graph, layouts, listener);
        listener.onRunStart(runId, inputs.scenarioName());

        try {
            for (int i = 0; i < graph.nodeCount(); i++) {
                Attribute a = graph.attribute(i);
                if (a.isInput())
                    ctx.set(i, inputs.get(a.identity()));
            }
            ctx.transition(RunState.LEVEL_PROCESSING);

            GroupDiagnostics[] diagnostics = new GroupDiagnostics[plan.groupCount()];
            List<GroupOutcome> memos = new ArrayList<>();
            boolean deadlinePassed = false;

            for (int level = 0; level < plan.levelCount(); level++) {
                token.checkCancelled();
                if (!deadlinePassed && token.deadlineExceeded()) {
                    deadlinePassed = true;
                    log.debug("Run {} [{}]: deadline passed before level {}", runId, inputs.scenarioName(), level);
                }
                List<EvaluationGroup> work = new ArrayList<>(plan.levelSize(level));
                boolean cyclic = false;
                for (int k = 0; k < plan.levelSize(level); k++) {
                    EvaluationGroup g = plan.group(plan.groupAt(level, k));
                    if (g.isInput())
                        continue;
                    work.add(g);
                    cyclic |= g.isCyclic();
                }
                if (work.isEmpty())
                    continue;

                if (cyclic)
                    ctx.transition(RunState.CONVERGING);
                List<GroupOutcome> outcomes = runLevel(level, work, ctx, options, token);
                for (int k = 0; k < work.size(); k++) {
                    GroupOutcome o = outcomes.get(k);
                    if (o.diagnostics() != null)
                        diagnostics[work.get(k).id()] = o.diagnostics();
                    if (o.memo() != null)
                        memos.add(o);
                }
                if (cyclic)
                    ctx.transition(RunState.LEVEL_PROCESSING);
            }

            List<GroupDiagnostics> cyclicDiagnostics = new ArrayList<>(plan.cyclicGroupCount());
            boolean truncated = deadlinePassed;
            boolean converged = !deadlinePassed;
            for (GroupDiagnostics d : diagnostics) {
                if (d == null)
                    continue;
                cyclicDiagnostics.add(d);
                converged &= d.converged();
                truncated |= d.termination() == GroupDiagnostics.Termination.DEADLINE_EXCEEDED;
            }
            boolean cacheable = !options.warmStart() && !truncated;

            for (GroupOutcome o : memos) {
                if (o.diagnostics() != null)
                    cache.rememberGroupValues(modelVersion, o.diagnostics().groupId(), o.memo().values());
                if (cacheable)
                    cache.putGroup(o.key(), o.memo());
            }

            Map<String, Double> values = new LinkedHashMap<>();
            for (int i = 0; i < graph.nodeCount(); i++)
                values.put(graph.attribute(i).identity(), ctx.get(i));

            RunState finalState = converged ? RunState.DONE : RunState.EXHAUSTED;
            ctx.transition(finalState);
            listener.onRunEnd(runId, finalState);
            if (deadlinePassed)
                log.warn("Run {} [{}]: deadline exceeded, remaining levels evaluated once", runId,
                        inputs.scenarioName());
            else if (!converged)
                log.warn("Run {} [{}]: {} cyclic group(s) did not converge", runId, inputs.scenarioName(),
                        cyclicDiagnostics.stream().filter(d -> !d.converged()).count());
            return new SimulationResult(modelVersion, inputs.scenarioName(), values, cyclicDiagnostics, finalState,
                    cacheable);
        } catch (RunCancelledException e) {
            abort(ctx, RunState.CANCELLED);
            log.info("Run {} [{}] cancelled", runId, inputs.scenarioName());
            throw e;
        } catch (RuntimeException | Error e) {
            abort(ctx, RunState.FAILED);
            log.error("Run {} [{}] failed: {}", runId, inputs.scenarioName(), e.getMessage());
            throw e;
        }
    }

    private void abort(EvaluationContext ctx, RunState terminal) {
        if (!ctx.state().isTerminal()) {
            ctx.transition(terminal);
            listener.onRunEnd(ctx.runId(), terminal);
        }
    }

    private List<GroupOutcome> runLevel(int level, List<EvaluationGroup> work, EvaluationContext ctx,
            RunOptions options, CancellationToken token) {
        List<GroupOutcome> outcomes = new ArrayList<>(work.size());
        if (workers == null || work.size() == 1) {
            for (EvaluationGroup g : work)
                outcomes.add(evaluateGroup(g, ctx, options, token));
            return outcomes;
        }

        List<Callable<GroupOutcome>> tasks = new ArrayList<>(work.size());
        for (EvaluationGroup g : work)
            tasks.add(() -> evaluateGroup(g, ctx, options, token));
        try {
            // invokeAll is the level barrier.
            List<Future<GroupOutcome>> futures = workers.invokeAll(tasks);
            // Failures surface in group order, so the reported error does not depend on thread timing.
            for (Future<GroupOutcome> f : futures)
                outcomes.add(f.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new RunCancelledException("Run " + ctx.runId() + " interrupted at level " + level);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            if (cause instanceof Error err)
                throw err;
            throw new IllegalStateException("Level " + level + " failed", cause);
        }
        return outcomes;
    }

    private GroupOutcome evaluateGroup(EvaluationGroup group, EvaluationContext ctx, RunOptions options,
            CancellationToken token) {
        GroupKey key = new GroupKey(modelVersion, group.id(), index.upstreamValues(group.id(), ctx.values()),
                options);
        CachedGroup memo = cache.getGroup(key);
        if (memo != null) {
            for (int k = 0; k < group.memberCount(); k++)
                ctx.set(group.member(k), memo.value(k));
            GroupDiagnostics d = memo.diagnostics() == null ? null : memo.diagnostics().asReused();
            log.trace("Run {}: reused {}", ctx.runId(), group);
            return new GroupOutcome(d, null, null);
        }

        if (!group.isCyclic()) {
            double v = ctx.evaluate(group.firstMember(), 0);
            return new GroupOutcome(null, key, new CachedGroup(new double[] { v }, null));
        }

        double[] initial = options.warmStart() ? cache.latestGroupValues(modelVersion, group.id()) : null;
        GroupDiagnostics d = solver.solve(group, ctx, options, initial, token);
        listener.onGroupSolved(ctx.runId(), d);
        log.debug("Run {}: {} {} after {} iterations (maxDelta={})", ctx.runId(), group, d.termination(),
                d.iterations(), d.maxDelta());
        return new GroupOutcome(d, key, new CachedGroup(ctx.memberValues(group), d));
    }

    public EvaluationPlan plan() {
        return plan;
    }
}
