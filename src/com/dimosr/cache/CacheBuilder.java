package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.dimosr.cache.core.MetricsCollector;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A builder used to create a cache with a combination of capabilities.
 * Currently, the available capabilities are the following:
 * - capacity bound (least recently used entries are evicted)
 * - expiration (entries expire a fixed duration after they are written)
 * - monitoring (hit/miss metrics)
 *
 * The capabilities are layered on top of a {@link KeyValueStore}.
 * The layering is such that:
 * - Expiration is above the capacity bound, so that expired entries still count towards the capacity
 *   until they are observed, and reading an entry refreshes its recency
 * - Monitoring is at the top, so that a read of an expired entry is counted as a miss
 *
 * The layering on top of the store is the following:
 *
 * -------------------------------------------------
 * |                Monitoring                     |
 * -------------------------------------------------
 * |                Expiration                     |
 * -------------------------------------------------
 * |              Capacity (LRU)                   |
 * -------------------------------------------------
 * |              KeyValueStore                    |
 * -------------------------------------------------
 */
public class CacheBuilder<K, V> {
    private Map<K, V> initialValues = Collections.emptyMap();

    private Integer capacity;

    private ExpirationDuration expiration;
    private Clock clock = Clock.systemUTC();

    private String cacheID;
    private MetricsCollector metricsCollector;

    /**
     * Seeds the cache with the given values
     */
    public CacheBuilder<K, V> withInitialValues(final Map<K, V> initialValues) {
        this.initialValues = checkNotNull(initialValues, "initialValues");
        return this;
    }

    /**
     * Enables the capacity bound, so that the least recently used entries are evicted
     * @param capacity the maximum number of entries the cache will hold
     */
    public CacheBuilder<K, V> withCapacity(final int capacity) {
        checkArgument(capacity >= 0, "The capacity cannot be negative, but it was: %s", capacity);
        this.capacity = capacity;
        return this;
    }

    /**
     * Enables expiration
     * @param expiration how long each entry lives after it is written
     */
    public CacheBuilder<K, V> withExpiration(final ExpirationDuration expiration) {
        this.expiration = checkNotNull(expiration, "expiration");
        return this;
    }

    /**
     * Sets the clock used for expiration and for the timestamps of the metrics
     * Defaults to the system UTC clock
     */
    public CacheBuilder<K, V> withClock(final Clock clock) {
        this.clock = checkNotNull(clock, "clock");
        return this;
    }

    /**
     * Enables monitoring capabilities.
     * The provided metricsCollector will be used to emit a metric for every read
     *
     * @param cacheID the ID under which the metrics will be emitted
     * @param metricsCollector the collector used to emit the metrics
     */
    public CacheBuilder<K, V> withMonitoring(final String cacheID, final MetricsCollector metricsCollector) {
        this.cacheID = checkNotNull(cacheID, "cacheID");
        this.metricsCollector = checkNotNull(metricsCollector, "metricsCollector");
        return this;
    }

    public Cacheable<K, V> build() {
        Cacheable<K, V> cache = buildStorage();
        if(metricsCollector != null) {
            cache = new MonitoredCache<>(cache, cacheID, clock, metricsCollector);
        }
        return cache;
    }

    private Cacheable<K, V> buildStorage() {
        if(expiration != null && capacity != null) {
            LRUCache<K, ExpiringValue<V>> boundedStore = new LRUCache<>(capacity, new KeyValueStore<K, ExpiringValue<V>>());
            return new ExpiringCache<>(expiration, clock, boundedStore, initialValues);
        } else if(expiration != null) {
            return new ExpiringCache<>(expiration, clock, initialValues);
        } else if(capacity != null) {
            return new LRUCache<>(capacity, initialValues);
        }
        return new KeyValueStore<>(initialValues);
    }
}
