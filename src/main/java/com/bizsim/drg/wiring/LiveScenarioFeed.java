package com.bizsim.drg.wiring;

import com.bizsim.drg.engine.RunOptions;
import com.bizsim.drg.engine.SimulationEngine;
import com.bizsim.drg.engine.SimulationResult;
import com.bizsim.drg.model.Attribute;
import com.bizsim.drg.model.Scenario;
import com.bizsim.drg.util.ErrorRateLimiter;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Streams input updates into a scenario and re-runs it once per batch.
 *
 * Producers call {@link #publish(String, double)} from any thread; updates go
 * through an LMAX Disruptor ring buffer to a single consumer thread, which
 * owns the live overrides.
 *
 * Batching/Coalescing:
 * The Disruptor's endOfBatch flag tells the consumer that no more events are
 * immediately available. Until then updates are only folded into the live
 * overrides; one run happens per batch (or earlier if an event asks for it with
 * batchEnd). A burst of updates therefore costs one run, and unchanged groups
 * are still served from the group cache.
 *
 * Errors in a run are logged (rate-limited) and reported to the callback; the
 * consumer thread stays alive.
 */
public final class LiveScenarioFeed implements EventHandler<InputUpdateEvent>, AutoCloseable {
    private static final Logger log = LogManager.getLogger(LiveScenarioFeed.class);
    public static final int DEFAULT_RING_SIZE = 1024;

    private final SimulationEngine engine;
    private final String scenarioName;
    private final RunOptions options;
    private final Attribute[] attributes;
    private final Map<String, Double> overrides;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final Disruptor<InputUpdateEvent> disruptor;
    private final RingBuffer<InputUpdateEvent> ringBuffer;

    private volatile BatchCallback callback;
    private volatile SimulationResult latest;
    private long batches;

    public LiveScenarioFeed(SimulationEngine engine, Scenario base, RunOptions options) {
        this(engine, base, options, DEFAULT_RING_SIZE);
    }

    /**
     * @param ringSize Ring buffer capacity, a power of two.
     */
    public LiveScenarioFeed(SimulationEngine engine, Scenario base, RunOptions options, int ringSize) {
        this.engine = engine;
        this.scenarioName = base.name();
        this.options = options;
        this.attributes = engine.registry().attributes().toArray(new Attribute[0]);
        this.overrides = new LinkedHashMap<>(base.overrides());

        this.disruptor = new Disruptor<>(InputUpdateEvent::new, ringSize, DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI, new BlockingWaitStrategy());
        disruptor.handleEventsWith(this);
        this.ringBuffer = disruptor.start();
        log.info("Live feed started for scenario '{}' (ring size {})", scenarioName, ringSize);
    }

    public void setCallback(BatchCallback callback) {
        this.callback = callback;
    }

    /**
     * Queues an input update.
     *
     * @throws IllegalArgumentException if the identity is not an input attribute.
     */
    public void publish(String identity, double value) {
        publish(identity, value, false);
    }

    /** Queues an input update; with batchEnd the consumer runs right after applying it. */
    public void publish(String identity, double value, boolean batchEnd) {
        Attribute a = engine.registry().resolve(identity);
        if (!a.isInput())
            throw new IllegalArgumentException("Only input attributes can be published, got " + identity);
        if (!Double.isFinite(value))
            throw new IllegalArgumentException("Value for " + identity + " must be finite, got " + value);
        ringBuffer.publishEvent((event, sequence, index, v) -> event.set(index, v, batchEnd, sequence),
                a.index(), value);
    }

    @Override
    public void onEvent(InputUpdateEvent event, long sequence, boolean endOfBatch) {
        int idx = event.inputIndex();
        if (idx < 0 || idx >= attributes.length || !attributes[idx].isInput()) {
            log.error("Received update for invalid input index {} (seq={})", idx, sequence);
            event.clear();
            return;
        }
        overrides.put(attributes[idx].identity(), event.value());
        boolean runNow = event.isBatchEnd() || endOfBatch;
        event.clear();
        if (runNow)
            runBatch();
    }

    private void runBatch() {
        long batch = ++batches;
        BatchCallback cb = callback;
        try {
            SimulationResult result = engine.run(new Scenario(scenarioName, overrides), options);
            latest = result;
            if (cb != null)
                cb.onResult(batch, result);
        } catch (RuntimeException e) {
            errLimiter.log("Live run " + batch + " of '" + scenarioName + "' failed: " + e.getMessage(), e);
            if (cb != null)
                cb.onError(batch, e);
        }
    }

    /** Result of the most recent successful batch, or null. */
    public SimulationResult latest() {
        return latest;
    }

    @Override
    public void close() {
        // Drains queued events before stopping the consumer.
        disruptor.shutdown();
        log.info("Live feed for '{}' stopped after {} batches", scenarioName, batches);
    }

    /** Receives the outcome of each batch on the consumer thread. */
    public interface BatchCallback {
        void onResult(long batch, SimulationResult result);

        default void onError(long batch, RuntimeException error) {
        }
    }
}
