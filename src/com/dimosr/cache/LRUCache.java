package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A cache holding at most {@code capacity} entries, evicting the least recently used one
 * when a write takes it over that limit.
 *
 * Successful reads ({@code get}, {@code resolve}) and {@code contains} checks count as a use of the key,
 * as do writes. {@code require} and the snapshot methods do not.
 *
 * The recency of the keys is tracked in a list ordered from least to most recently used,
 * which always holds exactly the keys of the underlying store.
 * Every operation holds this cache's lock for its whole read-modify-write sequence, so that the
 * recency list and the store never disagree. The store's own lock is only ever taken while
 * holding this one, never the other way round.
 *
 * A capacity of zero is allowed: every written entry is evicted straight away.
 */
public class LRUCache<K, V> implements Cacheable<K, V> {
    private static final Logger log = LoggerFactory.getLogger(LRUCache.class);

    private final Cacheable<K, V> store;
    private final int capacity;

    /**
     * Least recently used key first
     */
    private final LinkedHashSet<K> recency;

    private final Lock lock = new ReentrantLock();

    public LRUCache(final int capacity) {
        this(capacity, Collections.emptyMap());
    }

    /**
     * Creates a cache seeded with the given values, whose capacity is the number of values
     */
    public LRUCache(final Map<K, V> initialValues) {
        this(initialValues.size(), initialValues);
    }

    /**
     * Creates a cache seeded with the given values in their iteration order,
     * so if there are more values than the capacity, the first ones are evicted
     */
    public LRUCache(final int capacity, final Map<K, V> initialValues) {
        this(capacity, new KeyValueStore<>());
        for(Map.Entry<K, V> entry : initialValues.entrySet()) {
            store.set(entry.getKey(), entry.getValue());
            promote(entry.getKey());
        }
        evictOverflow();
    }

    /**
     * Layers the policy on an existing store, which from now on must only be accessed through this cache.
     * Keys already in the store are tracked in the order the store reports them.
     */
    LRUCache(final int capacity, final Cacheable<K, V> store) {
        checkArgument(capacity >= 0, "The capacity cannot be negative, but it was: %s", capacity);
        this.capacity = capacity;
        this.store = checkNotNull(store, "store");
        this.recency = new LinkedHashSet<>(store.allValues().keySet());
        evictOverflow();
    }

    @Override
    public Optional<V> get(final K key) {
        lock.lock();
        try {
            Optional<V> value = store.get(key);
            if(value.isPresent()) {
                promote(key);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> Optional<T> get(final K key, final Class<T> type) {
        lock.lock();
        try {
            Optional<T> value = store.get(key, type);
            if(value.isPresent()) {
                promote(key);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public V resolve(final K key) {
        lock.lock();
        try {
            V value = store.resolve(key);
            promote(key);
            return value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T resolve(final K key, final Class<T> type) {
        lock.lock();
        try {
            T value = store.resolve(key, type);
            promote(key);
            return value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(final K key, final V value) {
        lock.lock();
        try {
            store.set(key, value);
            promote(key);
            evictOverflow();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(final K key) {
        lock.lock();
        try {
            store.remove(key);
            recency.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(final K key) {
        lock.lock();
        try {
            if(!store.contains(key)) {
                return false;
            }
            promote(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public LRUCache<K, V> require(final K key) {
        return require(ImmutableSet.of(key));
    }

    @Override
    public LRUCache<K, V> require(final Set<K> keys) {
        lock.lock();
        try {
            store.require(keys);
        } finally {
            lock.unlock();
        }
        return this;
    }

    @Override
    public <T> Map<K, T> valuesOfType(final Class<T> type) {
        lock.lock();
        try {
            return store.valuesOfType(type);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<K, V> allValues() {
        lock.lock();
        try {
            return store.allValues();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public int size() {
        lock.lock();
        try {
            return recency.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Must be called while holding the lock
     */
    private void promote(final K key) {
        recency.remove(key);
        recency.add(key);
    }

    /**
     * Must be called while holding the lock
     */
    private void evictOverflow() {
        while(recency.size() > capacity) {
            K leastRecentlyUsed = recency.iterator().next();
            recency.remove(leastRecentlyUsed);
            store.remove(leastRecentlyUsed);
            log.debug("Capacity of {} exceeded, evicted least recently used key {}", capacity, leastRecentlyUsed);
        }
    }
}
