package com.gatekeeper.core.cache;

/**
 * Point-in-time counters of a {@link ValidationCache}.
 */
public record CacheStats(int size, long hits, long misses, long evictions, long expirations) {}
