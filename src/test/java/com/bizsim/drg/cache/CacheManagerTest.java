package com.bizsim.drg.cache;

import com.bizsim.drg.CostModels;
import com.bizsim.drg.engine.CancellationToken;
import com.bizsim.drg.engine.RunCancelledException;
import com.bizsim.drg.engine.RunOptions;
import com.bizsim.drg.engine.RunState;
import com.bizsim.drg.engine.SimulationResult;
import com.bizsim.drg.graph.DependencyGraphBuilder;
import com.bizsim.drg.graph.EvaluationPlan;
import com.bizsim.drg.graph.GraphAnalyzer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class CacheManagerTest {

    private CacheManager cache;
    private ExecutorService pool;

    @Before
    public void setUp() {
        cache = new CacheManager(16);
        pool = Executors.newFixedThreadPool(8);
    }

    @After
    public void tearDown() {
        pool.shutdownNow();
    }

    private static Fingerprint fp(String version, String scenario) {
        return new Fingerprint(version, scenario, Integer.toHexString((version + scenario).hashCode()));
    }

    private static SimulationResult result(String scenario, boolean cacheable) {
        return new SimulationResult("1", scenario, Map.of("A.x", 1.0), List.of(), RunState.DONE, cacheable);
    }

    @Test
    public void testSingleFlight() throws Exception {
        Fingerprint key = fp("1", "S");
        AtomicInteger computations = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SimulationResult expected = result("S", true);

        List<Future<SimulationResult>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(pool.submit(() -> cache.getOrCompute(key, () -> {
                computations.incrementAndGet();
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return expected;
            })));
        }
        assertTrue(started.await(5, TimeUnit.SECONDS));
        release.countDown();
        for (Future<SimulationResult> f : futures)
            assertSame(expected, f.get(5, TimeUnit.SECONDS));

        assertEquals(1, computations.get());
        CacheStats stats = cache.stats();
        assertEquals(1, stats.misses());
        assertEquals(7, stats.hits());
        assertEquals(1, stats.resultEntries());
        assertSame(expected, cache.get(key).orElseThrow());
    }

    @Test
    public void testFailureIsSharedThenForgotten() throws Exception {
        Fingerprint key = fp("1", "S");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<SimulationResult> owner = pool.submit(() -> cache.getOrCompute(key, () -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("boom");
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        FutureTask<SimulationResult> waiter = new FutureTask<>(() -> cache.getOrCompute(key, () -> result("S", true)));
        Thread waiterThread = new Thread(waiter, "waiter");
        waiterThread.start();
        awaitParked(waiterThread);
        release.countDown();

        assertCause(owner, IllegalStateException.class);
        assertCause(waiter, IllegalStateException.class);
        assertFalse(cache.get(key).isPresent());

        SimulationResult ok = result("S", true);
        assertSame(ok, cache.getOrCompute(key, () -> ok));
    }

    @Test
    public void testWaiterRetriesAfterCancellation() throws Exception {
        Fingerprint key = fp("1", "S");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SimulationResult own = result("S", true);

        Future<SimulationResult> owner = pool.submit(() -> cache.getOrCompute(key, () -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new RunCancelledException("cancelled by owner");
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        Future<SimulationResult> waiter = pool.submit(() -> cache.getOrCompute(key, () -> own));
        release.countDown();

        assertCause(owner, RunCancelledException.class);
        assertSame(own, waiter.get(5, TimeUnit.SECONDS));
        assertSame(own, cache.get(key).orElseThrow());
    }

    @Test
    public void testWaiterStopsWhenItsOwnTokenIsCancelled() throws Exception {
        Fingerprint key = fp("1", "S");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SimulationResult owned = result("S", true);

        Future<SimulationResult> owner = pool.submit(() -> cache.getOrCompute(key, () -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return owned;
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CancellationToken token = new CancellationToken();
        FutureTask<SimulationResult> waiter = new FutureTask<>(
                () -> cache.getOrCompute(key, token, () -> result("S", true)));
        Thread waiterThread = new Thread(waiter, "waiter");
        waiterThread.start();
        awaitParked(waiterThread);

        token.cancel();
        assertCause(waiter, RunCancelledException.class);
        assertFalse(owner.isDone());

        release.countDown();
        assertSame(owned, owner.get(5, TimeUnit.SECONDS));
        assertSame(owned, cache.get(key).orElseThrow());
    }

    @Test
    public void testWaiterComputesItsOwnWhenSharedResultIsNotCacheable() throws Exception {
        Fingerprint key = fp("1", "S");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SimulationResult partial = result("S", false);
        SimulationResult own = result("S", true);

        Future<SimulationResult> owner = pool.submit(() -> cache.getOrCompute(key, () -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return partial;
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        FutureTask<SimulationResult> waiter = new FutureTask<>(() -> cache.getOrCompute(key, () -> own));
        Thread waiterThread = new Thread(waiter, "waiter");
        waiterThread.start();
        awaitParked(waiterThread);
        release.countDown();

        assertSame(partial, owner.get(5, TimeUnit.SECONDS));
        assertSame(own, waiter.get(5, TimeUnit.SECONDS));
        assertSame(own, cache.get(key).orElseThrow());
        assertEquals(0, cache.stats().hits());
        assertEquals(2, cache.stats().misses());
    }

    @Test
    public void testNonCacheableResultIsReturnedButNotStored() {
        Fingerprint key = fp("1", "S");
        SimulationResult r = result("S", false);
        assertSame(r, cache.getOrCompute(key, () -> r));
        assertFalse(cache.get(key).isPresent());
        assertEquals(0, cache.stats().resultEntries());
    }

    @Test
    public void testOldestResultIsEvictedFirst() {
        CacheManager small = new CacheManager(2);
        small.put(fp("1", "a"), result("a", true));
        small.put(fp("1", "b"), result("b", true));
        small.put(fp("1", "c"), result("c", true));
        assertFalse(small.get(fp("1", "a")).isPresent());
        assertTrue(small.get(fp("1", "c")).isPresent());
        assertEquals(1, small.stats().evictions());
        assertEquals(2, small.stats().resultEntries());
    }

    @Test
    public void testRewriteMakesEntryNewest() {
        CacheManager small = new CacheManager(2);
        small.put(fp("1", "a"), result("a", true));
        small.put(fp("1", "b"), result("b", true));
        small.put(fp("1", "a"), result("a", true));
        small.put(fp("1", "c"), result("c", true));
        assertTrue(small.get(fp("1", "a")).isPresent());
        assertFalse(small.get(fp("1", "b")).isPresent());
        assertTrue(small.get(fp("1", "c")).isPresent());
        assertEquals(1, small.stats().evictions());
        assertEquals(2, small.stats().resultEntries());

        for (int i = 0; i < 10_000; i++)
            small.put(fp("1", "c"), result("c", true));
        assertEquals(2, small.stats().resultEntries());
        assertEquals(1, small.stats().evictions());
    }

    @Test
    public void testInvalidatedKeyIsForgottenByEvictionOrder() {
        CacheManager small = new CacheManager(3);
        small.put(fp("1", "a"), result("a", true));
        assertEquals(1, small.invalidateModelVersion("1"));
        small.put(fp("2", "b"), result("b", true));
        small.put(fp("2", "c"), result("c", true));
        small.put(fp("1", "a"), result("a", true));
        small.put(fp("2", "d"), result("d", true));

        assertTrue(small.get(fp("1", "a")).isPresent());
        assertFalse(small.get(fp("2", "b")).isPresent());
        assertTrue(small.get(fp("2", "d")).isPresent());
        assertEquals(3, small.stats().resultEntries());
        assertEquals(1, small.stats().evictions());
    }

    @Test
    public void testGroupRewriteAndReputAfterInvalidation() {
        CacheManager small = new CacheManager(2);
        RunOptions o = RunOptions.defaults();
        GroupKey k1 = new GroupKey("1", 0, new double[] { 1 }, o);
        GroupKey k2 = new GroupKey("1", 1, new double[] { 1 }, o);
        GroupKey k3 = new GroupKey("1", 2, new double[] { 1 }, o);
        small.putGroup(k1, new CachedGroup(new double[] { 1 }, null));
        small.putGroup(k2, new CachedGroup(new double[] { 2 }, null));
        small.putGroup(k1, new CachedGroup(new double[] { 1 }, null));
        small.putGroup(k3, new CachedGroup(new double[] { 3 }, null));
        assertNotNull(small.getGroup(k1));
        assertNull(small.getGroup(k2));
        assertNotNull(small.getGroup(k3));

        assertEquals(2, small.invalidateModelVersion("1"));
        small.putGroup(k2, new CachedGroup(new double[] { 2 }, null));
        small.putGroup(k3, new CachedGroup(new double[] { 3 }, null));
        small.putGroup(k2, new CachedGroup(new double[] { 2 }, null));
        small.putGroup(k1, new CachedGroup(new double[] { 1 }, null));
        assertNotNull(small.getGroup(k2));
        assertNull(small.getGroup(k3));
        assertNotNull(small.getGroup(k1));
        assertEquals(2, small.stats().groupEntries());
        assertEquals(2, small.stats().evictions());
    }

    @Test
    public void testGroupTier() {
        RunOptions o = RunOptions.defaults();
        GroupKey k = new GroupKey("1", 3, new double[] { 120, 60 }, o);
        assertNull(cache.getGroup(k));
        cache.putGroup(k, new CachedGroup(new double[] { 1, 2 }, null));

        CachedGroup hit = cache.getGroup(new GroupKey("1", 3, new double[] { 120, 60 }, o));
        assertNotNull(hit);
        assertEquals(2.0, hit.value(1), 0.0);
        assertNull(cache.getGroup(new GroupKey("1", 3, new double[] { 120, 61 }, o)));
        assertNull(cache.getGroup(new GroupKey("1", 3, new double[] { 120, 60 }, o.withThreshold(0.1))));

        CacheStats stats = cache.stats();
        assertEquals(1, stats.groupHits());
        assertEquals(3, stats.groupMisses());
        assertEquals(1, stats.groupEntries());
    }

    @Test
    public void testLatestGroupValuesAreCopies() {
        assertNull(cache.latestGroupValues("1", 0));
        double[] v = { 1, 2 };
        cache.rememberGroupValues("1", 0, v);
        v[0] = 99;
        assertArrayEquals(new double[] { 1, 2 }, cache.latestGroupValues("1", 0), 0.0);
    }

    @Test
    public void testInvalidateInputEvictsDownstreamClosureOnly() {
        EvaluationPlan plan = GraphAnalyzer.analyze(DependencyGraphBuilder.build(CostModels.registry()));
        cache.register("1.0", DependencyIndex.of(plan));
        int production = plan.groupOf(plan.graph().index("Production.co2Cost"));
        int logistics = plan.groupOf(plan.graph().index("Logistics.ecoFees"));
        RunOptions o = RunOptions.defaults();
        GroupKey pk = new GroupKey("1.0", production, new double[] { 120, 60 }, o);
        GroupKey lk = new GroupKey("1.0", logistics, new double[] { 120, 60, 35 }, o);
        GroupKey otherVersion = new GroupKey("2.0", logistics, new double[] { 120, 60, 35 }, o);
        cache.putGroup(pk, new CachedGroup(new double[] { 1, 2 }, null));
        cache.putGroup(lk, new CachedGroup(new double[] { 3, 4 }, null));
        cache.putGroup(otherVersion, new CachedGroup(new double[] { 3, 4 }, null));
        cache.put(fp("1.0", "Base"), result("Base", true));
        cache.put(fp("2.0", "Base"), result("Base", true));

        assertEquals(2, cache.invalidateInput("1.0", "Logistics.transportCost"));
        assertNotNull(cache.getGroup(pk));
        assertNull(cache.getGroup(lk));
        assertNotNull(cache.getGroup(otherVersion));
        assertFalse(cache.get(fp("1.0", "Base")).isPresent());
        assertTrue(cache.get(fp("2.0", "Base")).isPresent());

        assertEquals(1, cache.invalidateInput("1.0", "Production.energyCost"));
        assertNull(cache.getGroup(pk));
        assertEquals(0, cache.invalidateInput("unregistered", "Production.energyCost"));
    }

    @Test
    public void testInvalidateModelVersionAndClear() {
        cache.put(fp("1", "a"), result("a", true));
        cache.put(fp("2", "a"), result("a", true));
        cache.putGroup(new GroupKey("1", 0, new double[0], RunOptions.defaults()), new CachedGroup(new double[] { 1 }, null));
        assertEquals(2, cache.invalidateModelVersion("1"));
        assertTrue(cache.get(fp("2", "a")).isPresent());

        cache.clear();
        assertEquals(0, cache.stats().resultEntries());
        assertEquals(0, cache.stats().groupEntries());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveBound() {
        new CacheManager(0);
    }

    private static void awaitParked(Thread t) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (t.getState() != Thread.State.WAITING && System.nanoTime() < deadline)
            Thread.sleep(1);
        assertEquals(Thread.State.WAITING, t.getState());
    }

    private static void assertCause(Future<?> f, Class<? extends Throwable> type) throws Exception {
        try {
            f.get(5, TimeUnit.SECONDS);
            fail("Expected " + type.getSimpleName());
        } catch (ExecutionException e) {
            assertTrue(String.valueOf(e.getCause()), type.isInstance(e.getCause()));
        }
    }
}
