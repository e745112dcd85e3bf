package com.bizsim.drg.cache;

import com.bizsim.drg.engine.CancellationToken;
import com.bizsim.drg.engine.RunCancelledException;
import com.bizsim.drg.engine.SimulationResult;

import java.util.BitSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

/**
 * Shared result store for all runs of an engine.
 *
 * Responsibilities:
 * - Scenario-level cache: fingerprint -> final {@link SimulationResult}. A hit
 * short-circuits the scheduler entirely.
 * - Single-flight: concurrent callers for one fingerprint share one
 * computation. The first caller computes; the others await its future.
 * - Group-level cache: {@link GroupKey} -> {@link CachedGroup}. Lets a
 * scenario-level miss reuse every group whose upstream inputs did not change.
 * - Warm-start memory: the most recent values of each cyclic group.
 * - Invalidation by input (downstream closure only), by model version, or all.
 *
 * Failure policy:
 * A computation that throws leaves no entry behind. Waiters of a failed
 * computation receive the same failure; waiters of a cancelled one retry on
 * their own behalf, since the cancellation belonged to another caller. A
 * waiter handed a non-cacheable result also computes its own. A waiter whose
 * own token is cancelled stops waiting at once.
 *
 * Entries are immutable once written. Each tier holds at most
 * {@code maxEntries} completed entries; the least recently written are
 * evicted first. Insertion order lives in one structure per tier and is
 * changed only under that structure's lock, together with the entries.
 *
 * Thread-safe. This is the only structure shared between concurrent runs.
 */
@Log4j2
public final class CacheManager {
    private final int maxEntries;

    // Completed entries are added and removed only under the resultOrder lock.
    private final ConcurrentHashMap<Fingerprint, CompletableFuture<SimulationResult>> results = new ConcurrentHashMap<>();
    private final LinkedHashSet<Fingerprint> resultOrder = new LinkedHashSet<>();

    // Iteration order is write order. Guarded by itself.
    private final LinkedHashMap<GroupKey, CachedGroup> groups = new LinkedHashMap<>();

    private final ConcurrentHashMap<String, double[]> latestGroupValues = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DependencyIndex> indexes = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong groupHits = new AtomicLong();
    private final AtomicLong groupMisses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public CacheManager(int maxEntries) {
        if (maxEntries < 1)
            throw new IllegalArgumentException("maxEntries must be >= 1, got " + maxEntries);
        this.maxEntries = maxEntries;
    }

    /** Makes a model version's reverse-dependency index available for input invalidation. */
    public void register(String modelVersion, DependencyIndex index) {
        indexes.put(modelVersion, index);
    }

    // ── Scenario-level tier ────────────────────────────────────────────

    /** Returns a completed entry. In-flight computations are not awaited. */
    public Optional<SimulationResult> get(Fingerprint fingerprint) {
        CompletableFuture<SimulationResult> f = results.get(fingerprint);
        if (f == null || !f.isDone() || f.isCompletedExceptionally())
            return Optional.empty();
        return Optional.of(f.join());
    }

    /** Stores a result, replacing any previous entry for the fingerprint and making it the newest. */
    public void put(Fingerprint fingerprint, SimulationResult result) {
        synchronized (resultOrder) {
            results.put(fingerprint, CompletableFuture.completedFuture(result));
            touch(fingerprint);
        }
    }

    public SimulationResult getOrCompute(Fingerprint fingerprint, Supplier<SimulationResult> computation) {
        return getOrCompute(fingerprint, CancellationToken.none(), computation);
    }

    /**
     * Returns the cached result for the fingerprint, or runs the computation
     * exactly once across concurrent callers and caches its result if the
     * result is cacheable.
     *
     * @param token The caller's own token; cancelling it ends the wait for
     *              another caller's computation.
     * @throws RuntimeException      whatever the computation threw, for the
     *                               caller that ran it and for every waiter
     *                               (except cancellation, on which waiters
     *                               retry).
     * @throws RunCancelledException if {@code token} is cancelled while waiting.
     */
    public SimulationResult getOrCompute(Fingerprint fingerprint, CancellationToken token,
            Supplier<SimulationResult> computation) {
        while (true) {
            CompletableFuture<SimulationResult> existing = results.get(fingerprint);
            if (existing != null) {
                if (!existing.isDone()) {
                    CompletableFuture.anyOf(existing.handle((r, e) -> null), token.whenCancelled()).join();
                    token.checkCancelled();
                }
                try {
                    SimulationResult shared = existing.join();
                    if (!shared.cacheable()) {
                        log.debug("Shared result for {} is not cacheable, computing our own", fingerprint);
                        results.remove(fingerprint, existing);
                        continue;
                    }
                    hits.incrementAndGet();
                    return shared;
                } catch (CompletionException | CancellationException e) {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof RunCancelledException) {
                        log.debug("Shared computation for {} was cancelled, retrying", fingerprint);
                        continue;
                    }
                    if (cause instanceof RuntimeException re)
                        throw re;
                    if (cause instanceof Error err)
                        throw err;
                    throw new CompletionException(cause);
                }
            }

            CompletableFuture<SimulationResult> mine = new CompletableFuture<>();
            if (results.putIfAbsent(fingerprint, mine) != null)
                continue; // lost the race, await the winner
            misses.incrementAndGet();

            SimulationResult result;
            try {
                result = computation.get();
            } catch (RuntimeException | Error e) {
                results.remove(fingerprint, mine);
                mine.completeExceptionally(e);
                throw e;
            }
            if (result.cacheable()) {
                synchronized (resultOrder) {
                    mine.complete(result);
                    touch(fingerprint);
                }
            } else {
                results.remove(fingerprint, mine);
                mine.complete(result);
            }
            return result;
        }
    }

    // Caller holds the resultOrder lock.
    private void touch(Fingerprint fingerprint) {
        resultOrder.remove(fingerprint);
        resultOrder.add(fingerprint);
        Iterator<Fingerprint> oldest = resultOrder.iterator();
        while (resultOrder.size() > maxEntries) {
            Fingerprint victim = oldest.next();
            oldest.remove();
            results.remove(victim);
            evictions.incrementAndGet();
            log.trace("Evicted {}", victim);
        }
    }

    private int completedResultCount() {
        synchronized (resultOrder) {
            return resultOrder.size();
        }
    }

    // ── Group-level tier ───────────────────────────────────────────────

    /** Returns the memoised group, or null. Counts a group hit or miss. */
    public CachedGroup getGroup(GroupKey key) {
        CachedGroup g;
        synchronized (groups) {
            g = groups.get(key);
        }
        if (g != null)
            groupHits.incrementAndGet();
        else
            groupMisses.incrementAndGet();
        return g;
    }

    /** Stores a group memo, making it the newest entry of the group tier. */
    public void putGroup(GroupKey key, CachedGroup group) {
        synchronized (groups) {
            groups.remove(key);
            groups.put(key, group);
            Iterator<GroupKey> oldest = groups.keySet().iterator();
            while (groups.size() > maxEntries) {
                oldest.next();
                oldest.remove();
                evictions.incrementAndGet();
            }
        }
    }

    /** Most recent member values of a cyclic group, or null if it was never solved. */
    public double[] latestGroupValues(String modelVersion, int groupId) {
        double[] v = latestGroupValues.get(latestKey(modelVersion, groupId));
        return v == null ? null : v.clone();
    }

    public void rememberGroupValues(String modelVersion, int groupId, double[] values) {
        latestGroupValues.put(latestKey(modelVersion, groupId), values.clone());
    }

    private static String latestKey(String modelVersion, int groupId) {
        return modelVersion + "#" + groupId;
    }

    // ── Invalidation ───────────────────────────────────────────────────

    /**
     * Evicts everything that can depend on the given attribute: group entries
     * in its downstream closure, and scenario-level entries of that version
     * (each one stores every attribute value, so each contains the closure).
     * Group entries outside the closure stay valid.
     *
     * @return Number of entries removed.
     */
    public int invalidateInput(String modelVersion, String identity) {
        DependencyIndex index = indexes.get(modelVersion);
        if (index == null)
            return 0;
        BitSet affected = index.affectedGroups(identity);
        int removed = 0;
        synchronized (groups) {
            for (Iterator<GroupKey> it = groups.keySet().iterator(); it.hasNext();) {
                GroupKey k = it.next();
                if (k.modelVersion().equals(modelVersion) && affected.get(k.groupId())) {
                    it.remove();
                    removed++;
                }
            }
        }
        for (int g = affected.nextSetBit(0); g >= 0; g = affected.nextSetBit(g + 1))
            latestGroupValues.remove(latestKey(modelVersion, g));
        if (!affected.isEmpty())
            removed += removeResults(modelVersion);
        log.debug("Invalidated {} entries downstream of {}@{}", removed, identity, modelVersion);
        return removed;
    }

    public int invalidateModelVersion(String modelVersion) {
        int removed = 0;
        synchronized (groups) {
            for (Iterator<GroupKey> it = groups.keySet().iterator(); it.hasNext();) {
                if (it.next().modelVersion().equals(modelVersion)) {
                    it.remove();
                    removed++;
                }
            }
        }
        latestGroupValues.keySet().removeIf(k -> k.startsWith(modelVersion + "#"));
        removed += removeResults(modelVersion);
        indexes.remove(modelVersion);
        log.info("Invalidated model version {} ({} entries)", modelVersion, removed);
        return removed;
    }

    // In-flight computations are never in resultOrder; their owner decides whether they get stored.
    private int removeResults(String modelVersion) {
        int removed = 0;
        synchronized (resultOrder) {
            for (Iterator<Fingerprint> it = resultOrder.iterator(); it.hasNext();) {
                Fingerprint f = it.next();
                if (f.modelVersion().equals(modelVersion)) {
                    it.remove();
                    results.remove(f);
                    removed++;
                }
            }
        }
        return removed;
    }

    public void clear() {
        synchronized (resultOrder) {
            for (Fingerprint f : resultOrder)
                results.remove(f);
            resultOrder.clear();
        }
        synchronized (groups) {
            groups.clear();
        }
        latestGroupValues.clear();
    }

    public CacheStats stats() {
        int groupEntries;
        synchronized (groups) {
            groupEntries = groups.size();
        }
        return new CacheStats(hits.get(), misses.get(), groupHits.get(), groupMisses.get(), evictions.get(),
                completedResultCount(), groupEntries);
    }

    public int maxEntries() {
        return maxEntries;
    }
}
