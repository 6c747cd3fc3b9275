package com.gatekeeper.core.cache;

import com.gatekeeper.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, TTL-expiring, least-recently-used cache of validation verdicts.
 * <p>
 * A single lock guards the backing map and is held only for the map operation
 * itself; callers compute verdicts (and run subprocesses) outside of it. Entries
 * whose age has reached the TTL are never returned: they are dropped lazily on
 * {@link #get} and purged eagerly once occupancy reaches the purge threshold.
 * <p>
 * Instances are built explicitly (see {@code GatekeeperConfig}) so tests can
 * create isolated caches with their own {@link Clock}.
 */
public class ValidationCache {

    private static final Logger log = LoggerFactory.getLogger(ValidationCache.class);

    private record Entry(Verdict verdict, Instant createdAt) {}

    private final int capacity;
    private final Duration ttl;
    private final int purgeAt;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<CacheKey, Entry> entries;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public ValidationCache(int capacity, Duration ttl, double purgeThreshold, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (purgeThreshold <= 0 || purgeThreshold > 1) {
            throw new IllegalArgumentException("purgeThreshold must be in (0, 1]: " + purgeThreshold);
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.purgeAt = Math.max(1, (int) Math.ceil(capacity * purgeThreshold));
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Returns the cached verdict, or empty on a miss or when the entry has expired.
     */
    public Optional<Verdict> get(CacheKey key) {
        lock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (isExpired(entry, clock.instant())) {
                entries.remove(key);
                expirations++;
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.verdict());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a verdict, evicting the least recently used entry when over capacity.
     */
    public void put(CacheKey key, Verdict verdict) {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (entries.size() >= purgeAt) {
                purgeExpired(now);
            }
            entries.put(key, new Entry(verdict, now));
            Iterator<Map.Entry<CacheKey, Entry>> it = entries.entrySet().iterator();
            while (entries.size() > capacity && it.hasNext()) {
                CacheKey eldest = it.next().getKey();
                it.remove();
                evictions++;
                log.debug("Evicted least recently used entry {}", eldest.resource());
            }
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(CacheKey key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /** Drops every entry. Counters are kept. */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), hits, misses, evictions, expirations);
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public Duration ttl() {
        return ttl;
    }

    private void purgeExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> isExpired(entry, now));
        int purged = before - entries.size();
        if (purged > 0) {
            expirations += purged;
            log.debug("Purged {} expired cache entries", purged);
        }
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.createdAt(), now).compareTo(ttl) >= 0;
    }
}
