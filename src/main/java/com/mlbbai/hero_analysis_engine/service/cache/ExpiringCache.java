/**
 * Time-bounded key/value store with per-entry time-to-live
 *
 * @author William Callahan
 *
 * Features:
 * - Caffeine-backed with variable expiry so each entry keeps its own TTL
 * - Expired entries are never returned, even before eviction runs
 * - Injectable ticker for deterministic expiry in tests
 * - Bounded size to keep memory usage predictable
 */
package com.mlbbai.hero_analysis_engine.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

public class ExpiringCache<K, V> {

    private final Cache<K, CacheEntry<V>> delegate;
    private final Duration defaultTtl;

    public ExpiringCache(Duration defaultTtl, long maximumSize, Ticker ticker) {
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.delegate = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .executor(Runnable::run)
            .expireAfter(new EntryExpiry<K, V>())
            .recordStats()
            .build();
    }

    public Optional<V> get(K key) {
        CacheEntry<V> entry = delegate.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    /**
     * Typed lookup for caches holding several value types. A value of another type reads as absent.
     */
    public <T> Optional<T> get(K key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    public void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        Duration effective = ttl == null || ttl.isNegative() || ttl.isZero() ? defaultTtl : ttl;
        delegate.put(key, new CacheEntry<>(value, effective));
    }

    public void flushAll() {
        delegate.invalidateAll();
        delegate.cleanUp();
    }

    /**
     * Number of live entries. Expired entries are purged before counting.
     */
    public long size() {
        delegate.cleanUp();
        return delegate.estimatedSize();
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    record CacheEntry<V>(V value, Duration ttl) {
    }

    private static final class EntryExpiry<K, V> implements Expiry<K, CacheEntry<V>> {

        @Override
        public long expireAfterCreate(K key, CacheEntry<V> entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(K key, CacheEntry<V> entry, long currentTime,
                                      long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(K key, CacheEntry<V> entry, long currentTime,
                                    long currentDuration) {
            return currentDuration;
        }
    }
}
