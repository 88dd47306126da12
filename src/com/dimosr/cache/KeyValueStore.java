package com.dimosr.cache;

import com.dimosr.cache.core.CacheListener;
import com.dimosr.cache.core.Cacheable;
import com.dimosr.cache.exceptions.MissingKeysException;
import com.dimosr.cache.util.TypeCasts;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A thread-safe key-value cache without any eviction or expiry policy.
 * It is the storage that all the other cache variants are layered on.
 *
 * Reads are performed under a shared read lock, mutations under the exclusive write lock.
 * Each public operation acquires the lock exactly once and never calls another locking
 * operation of this instance while holding it.
 *
 * The lock is a {@link ReentrantReadWriteLock}, so nested acquisition from the same thread is safe,
 * but that does not remove contention between threads.
 *
 * Listeners registered through {@link #addListener(CacheListener)} receive an immutable snapshot
 * of the contents after every mutation. The snapshot is taken under the write lock and published
 * after it has been released, so a listener can safely call back into the store.
 */
public class KeyValueStore<K, V> implements Cacheable<K, V> {
    private static final Logger log = LoggerFactory.getLogger(KeyValueStore.class);

    private final Map<K, V> entries;

    private final ReentrantReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    private final Lock readLock = readWriteLock.readLock();
    private final Lock writeLock = readWriteLock.writeLock();

    private final List<CacheListener<K, V>> listeners = new CopyOnWriteArrayList<>();

    public KeyValueStore() {
        this(Collections.emptyMap());
    }

    /**
     * @throws NullPointerException if any of the initial keys or values is null
     */
    public KeyValueStore(final Map<K, V> initialValues) {
        this.entries = new HashMap<>(ImmutableMap.copyOf(initialValues));
    }

    @Override
    public Optional<V> get(final K key) {
        checkNotNull(key, "key");
        readLock.lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public <T> Optional<T> get(final K key, final Class<T> type) {
        return get(key).flatMap(value -> TypeCasts.tryCast(value, type));
    }

    @Override
    public V resolve(final K key) {
        return get(key).orElseThrow(() -> MissingKeysException.forKey(key));
    }

    /**
     * The lookup happens once, so a missing key and a value of the wrong type
     * are told apart from the same observation of the store
     */
    @Override
    public <T> T resolve(final K key, final Class<T> type) {
        V value = resolve(key);
        return TypeCasts.cast(value, type);
    }

    @Override
    public void set(final K key, final V value) {
        checkNotNull(key, "key");
        checkNotNull(value, "value");

        Map<K, V> snapshot;
        writeLock.lock();
        try {
            entries.put(key, value);
            snapshot = snapshotForListeners();
        } finally {
            writeLock.unlock();
        }
        publish(snapshot);
    }

    @Override
    public void remove(final K key) {
        checkNotNull(key, "key");

        Map<K, V> snapshot;
        writeLock.lock();
        try {
            if(entries.remove(key) == null) {
                return;
            }
            snapshot = snapshotForListeners();
        } finally {
            writeLock.unlock();
        }
        publish(snapshot);
    }

    @Override
    public boolean contains(final K key) {
        checkNotNull(key, "key");
        readLock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public KeyValueStore<K, V> require(final K key) {
        return require(ImmutableSet.of(key));
    }

    @Override
    public KeyValueStore<K, V> require(final Set<K> keys) {
        Set<K> missingKeys = missingKeys(keys);
        if(!missingKeys.isEmpty()) {
            throw new MissingKeysException(missingKeys);
        }
        return this;
    }

    @Override
    public <T> Map<K, T> valuesOfType(final Class<T> type) {
        readLock.lock();
        try {
            return ImmutableMap.copyOf(TypeCasts.filterByType(entries, type));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Map<K, V> allValues() {
        readLock.lock();
        try {
            return ImmutableMap.copyOf(entries);
        } finally {
            readLock.unlock();
        }
    }

    public int size() {
        readLock.lock();
        try {
            return entries.size();
        } finally {
            readLock.unlock();
        }
    }

    public void addListener(final CacheListener<K, V> listener) {
        listeners.add(checkNotNull(listener, "listener"));
    }

    public void removeListener(final CacheListener<K, V> listener) {
        listeners.remove(listener);
    }

    /**
     * @return the subset of the given keys that are not in the store, computed under a single read lock
     */
    Set<K> missingKeys(final Set<K> keys) {
        ImmutableSet.Builder<K> missingKeys = ImmutableSet.builder();
        readLock.lock();
        try {
            for(K key : keys) {
                if(!entries.containsKey(key)) {
                    missingKeys.add(key);
                }
            }
        } finally {
            readLock.unlock();
        }
        return missingKeys.build();
    }

    /**
     * Must be called while holding the write lock
     */
    private Map<K, V> snapshotForListeners() {
        if(listeners.isEmpty()) {
            return null;
        }
        return ImmutableMap.copyOf(entries);
    }

    private void publish(final Map<K, V> snapshot) {
        if(snapshot == null) {
            return;
        }

        for(CacheListener<K, V> listener : listeners) {
            try {
                listener.onChange(snapshot);
            } catch(RuntimeException e) {
                log.warn("Cache listener {} failed while handling a change", listener, e);
            }
        }
    }
}
