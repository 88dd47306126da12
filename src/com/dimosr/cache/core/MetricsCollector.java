package com.dimosr.cache.core;

import java.time.Instant;

/**
 * An abstraction used to collect metrics from the caches
 *
 * Whether the collector is synchronous or asynchronous depends on each implementation
 * However, note that if the implementation is synchronous this will add latency
 * to every monitored cache read
 */
public interface MetricsCollector {
    void putMetric(String namespace, double value, Instant timestamp);
}
