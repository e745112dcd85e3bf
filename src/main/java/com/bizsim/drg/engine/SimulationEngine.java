package com.bizsim.drg.engine;

import com.bizsim.drg.api.EvaluationListener;
import com.bizsim.drg.cache.CacheManager;
import com.bizsim.drg.cache.DependencyIndex;
import com.bizsim.drg.cache.Fingerprint;
import com.bizsim.drg.graph.DependencyGraph;
import com.bizsim.drg.graph.DependencyGraphBuilder;
import com.bizsim.drg.graph.EvaluationPlan;
import com.bizsim.drg.graph.GraphAnalyzer;
import com.bizsim.drg.model.ModelRegistry;
import com.bizsim.drg.model.ResolvedInputs;
import com.bizsim.drg.model.Scenario;
import com.bizsim.drg.model.ScenarioStore;
import com.bizsim.drg.util.CompositeEvaluationListener;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for evaluating scenarios of one model version.
 *
 * This class handles:
 * <ul>
 * <li>Building the dependency graph and analysing it once per model
 * version</li>
 * <li>Resolving scenario inputs and fingerprinting them</li>
 * <li>Consulting the {@link CacheManager} before running the
 * {@link EvaluationScheduler}</li>
 * <li>Synchronous runs and cancellable asynchronous runs</li>
 * </ul>
 *
 * Results are deterministic for a fixed (model version, scenario inputs,
 * options). Engines may share one {@link CacheManager} as long as their model
 * versions differ.
 *
 * Close the engine to stop its worker threads.
 */
public final class SimulationEngine implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(SimulationEngine.class);

    private final ModelRegistry registry;
    private final ScenarioStore scenarios;
    private final EngineConfig config;
    private final CacheManager cache;
    private final EvaluationPlan plan;
    private final CompositeEvaluationListener listeners = new CompositeEvaluationListener();
    private final ExecutorService workers;
    private final ExecutorService coordinator;
    private final EvaluationScheduler scheduler;
    private final AtomicLong runIds = new AtomicLong();
    private volatile boolean closed;

    public SimulationEngine(ModelRegistry registry, ScenarioStore scenarios) {
        this(registry, scenarios, EngineConfig.load());
    }

    public SimulationEngine(ModelRegistry registry, ScenarioStore scenarios, EngineConfig config) {
        this(registry, scenarios, config, new CacheManager(config.cacheMaxEntries()));
    }

    public SimulationEngine(ModelRegistry registry, ScenarioStore scenarios, EngineConfig config,
            CacheManager cache) {
        this.registry = registry;
        this.scenarios = scenarios;
        this.config = config;
        this.cache = cache;

        DependencyGraph graph = DependencyGraphBuilder.build(registry);
        this.plan = GraphAnalyzer.analyze(graph);
        DependencyIndex index = DependencyIndex.of(plan);
        cache.register(registry.version(), index);

        this.workers = config.parallelism() > 1
                ? Executors.newFixedThreadPool(config.parallelism(), DaemonThreadFactory.INSTANCE)
                : null;
        // Async runs wait on level barriers; keeping them off the worker pool means they cannot starve it.
        this.coordinator = Executors.newCachedThreadPool(DaemonThreadFactory.INSTANCE);
        this.scheduler = new EvaluationScheduler(registry.version(), plan, index, cache, workers, listeners);

        log.info("Engine ready for {}@{}: {} attributes, {} groups ({} cyclic), {} levels, parallelism {}",
                registry.modelName(), registry.version(), registry.attributeCount(), plan.groupCount(),
                plan.cyclicGroupCount(), plan.levelCount(), config.parallelism());
    }

    // ── Runs ───────────────────────────────────────────────────────────

    public SimulationResult run(String scenarioName) {
        return run(scenarioName, defaultOptions());
    }

    /**
     * Evaluates a stored scenario.
     *
     * @throws com.bizsim.drg.model.ModelDefinitionException with UNKNOWN_SCENARIO for an unknown name.
     * @throws FormulaEvaluationException                      if a formula fails.
     */
    public SimulationResult run(String scenarioName, RunOptions options) {
        return run(scenarios.scenario(scenarioName), options);
    }

    /** Evaluates an ad-hoc scenario that need not be in the store. */
    public SimulationResult run(Scenario scenario, RunOptions options) {
        return execute(scenario, options, new CancellationToken(options.deadline()));
    }

    public RunHandle submit(String scenarioName, RunOptions options) {
        return submit(scenarios.scenario(scenarioName), options);
    }

    /** Starts a run on the coordinator pool and returns a cancellable handle. */
    public RunHandle submit(Scenario scenario, RunOptions options) {
        ensureOpen();
        CancellationToken token = new CancellationToken(options.deadline());
        CompletableFuture<SimulationResult> future = CompletableFuture
                .supplyAsync(() -> execute(scenario, options, token), coordinator);
        return new RunHandle(scenario.name(), future, token);
    }

    private SimulationResult execute(Scenario scenario, RunOptions options, CancellationToken token) {
        ensureOpen();
        ResolvedInputs inputs = ScenarioStore.resolveInputs(scenario, registry);
        Fingerprint fingerprint = Fingerprint.of(registry.version(), inputs, options);
        if (options.warmStart())
            return scheduler.execute(runIds.incrementAndGet(), inputs, options, token);
        if (options.deadline() != null) {
            // A deadline run may end early, so it never joins or owns a shared computation.
            Optional<SimulationResult> hit = cache.get(fingerprint);
            if (hit.isPresent())
                return hit.get();
            SimulationResult result = scheduler.execute(runIds.incrementAndGet(), inputs, options, token);
            if (result.cacheable())
                cache.put(fingerprint, result);
            return result;
        }
        return cache.getOrCompute(fingerprint, token,
                () -> scheduler.execute(runIds.incrementAndGet(), inputs, options, token));
    }

    /** Options built from the engine configuration. */
    public RunOptions defaultOptions() {
        return config.defaultRunOptions();
    }

    // ── Observability & cache ──────────────────────────────────────────

    public void addListener(EvaluationListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(EvaluationListener listener) {
        return listeners.remove(listener);
    }

    /** Evicts cached results that can depend on the given attribute of this model version. */
    public int invalidate(String identity) {
        registry.resolve(identity);
        return cache.invalidateInput(registry.version(), identity);
    }

    // ── Accessors ──────────────────────────────────────────────────────

    public ModelRegistry registry() {
        return registry;
    }

    public ScenarioStore scenarios() {
        return scenarios;
    }

    public EvaluationPlan plan() {
        return plan;
    }

    public CacheManager cache() {
        return cache;
    }

    public EngineConfig config() {
        return config;
    }

    private void ensureOpen() {
        if (closed)
            throw new IllegalStateException("Engine for " + registry.modelName() + "@" + registry.version()
                    + " is closed");
    }

    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        coordinator.shutdown();
        if (workers != null)
            workers.shutdown();
        try {
            if (!coordinator.awaitTermination(5, TimeUnit.SECONDS))
                coordinator.shutdownNow();
            if (workers != null && !workers.awaitTermination(5, TimeUnit.SECONDS))
                workers.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            coordinator.shutdownNow();
            if (workers != null)
                workers.shutdownNow();
        }
        log.info("Engine for {}@{} closed", registry.modelName(), registry.version());
    }
}
