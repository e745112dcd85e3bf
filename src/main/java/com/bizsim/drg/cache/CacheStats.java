package com.bizsim.drg.cache;

/**
 * Point-in-time cache counters.
 *
 * @param hits           Scenario-level lookups served from the cache (including waiters of a shared computation).
 * @param misses         Scenario-level lookups that started a computation.
 * @param groupHits      Groups reused instead of evaluated.
 * @param groupMisses    Groups evaluated.
 * @param evictions      Entries dropped by the size bound.
 * @param resultEntries  Scenario-level entries currently stored.
 * @param groupEntries   Group-level entries currently stored.
 */
public record CacheStats(long hits, long misses, long groupHits, long groupMisses, long evictions, int resultEntries,
        int groupEntries) {
}
