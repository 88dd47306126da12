package com.dimosr.cache.core;

import java.util.Map;

/**
 * A callback notified with the contents of a cache after every mutation
 *
 * Listeners are invoked synchronously on the mutating thread, after the cache has released its lock,
 * so they are free to call back into the cache.
 * When several threads mutate the cache concurrently, snapshots may be delivered out of order.
 */
@FunctionalInterface
public interface CacheListener<K, V> {
    void onChange(Map<K, V> snapshot);
}
