package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.dimosr.cache.core.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;

/**
 * A cache enhanced with monitoring capabilities.
 *
 * For now, the metrics emitted by this component include:
 * - hits (1) and misses (0) of each read ({@code get} and {@code resolve})
 */
class MonitoredCache<K, V> extends ForwardingCacheable<K, V> {
    private static final Logger log = LoggerFactory.getLogger(MonitoredCache.class);

    private final Cacheable<K, V> cache;
    private final String cacheID;
    private final Clock clock;
    private final MetricsCollector metricsCollector;

    private static final String METRIC_TEMPLATE = "Cache.%s.hit";

    /**
     * @param cache the underlying cache
     * @param cacheID the ID under which the metrics will be emitted
     * @param clock the clock used to timestamp the metrics
     * @param metricsCollector the collector used to emit the metrics
     */
    MonitoredCache(final Cacheable<K, V> cache,
                   final String cacheID,
                   final Clock clock,
                   final MetricsCollector metricsCollector) {
        this.cache = cache;
        this.cacheID = cacheID;
        this.clock = clock;
        this.metricsCollector = metricsCollector;
    }

    @Override
    protected Cacheable<K, V> delegate() {
        return cache;
    }

    @Override
    public Optional<V> get(final K key) {
        Optional<V> value = cache.get(key);
        recordRead(key, value.isPresent());
        return value;
    }

    @Override
    public <T> Optional<T> get(final K key, final Class<T> type) {
        Optional<T> value = cache.get(key, type);
        recordRead(key, value.isPresent());
        return value;
    }

    @Override
    public V resolve(final K key) {
        try {
            V value = cache.resolve(key);
            recordRead(key, true);
            return value;
        } catch(RuntimeException e) {
            recordRead(key, false);
            throw e;
        }
    }

    @Override
    public <T> T resolve(final K key, final Class<T> type) {
        try {
            T value = cache.resolve(key, type);
            recordRead(key, true);
            return value;
        } catch(RuntimeException e) {
            recordRead(key, false);
            throw e;
        }
    }

    @Override
    public MonitoredCache<K, V> require(final K key) {
        super.require(key);
        return this;
    }

    @Override
    public MonitoredCache<K, V> require(final Set<K> keys) {
        super.require(keys);
        return this;
    }

    private void recordRead(final K key, final boolean hit) {
        if(hit) {
            log.info("{}: Value for key {} was found in cache", cacheID, key);
        } else {
            log.info("{}: Value for key {} was not found in cache", cacheID, key);
        }

        final String metricName = String.format(METRIC_TEMPLATE, cacheID);
        metricsCollector.putMetric(metricName, hit ? 1 : 0, clock.instant());
    }
}
