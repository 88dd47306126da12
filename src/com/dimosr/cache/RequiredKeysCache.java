package com.dimosr.cache;

import com.dimosr.cache.core.CacheListener;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A cache with a set of required keys, which are guaranteed to be present.
 *
 * All the required keys have to be present when the cache is created or when a key is registered as required,
 * otherwise a {@link com.dimosr.cache.exceptions.MissingKeysException} is thrown.
 * Afterwards, removing a required key has no effect, so its value can be overwritten but never dropped.
 *
 * Accessing a key through the required-key methods ({@link #resolveRequired(Object, Class)},
 * {@link #update(Object, Class, Function)}, {@link #use(Object, Class, Function)}) when the key is not
 * registered as required is a programmer error, reported as an {@link IllegalArgumentException}.
 */
public class RequiredKeysCache<K, V> extends ForwardingCacheable<K, V> {
    private static final Logger log = LoggerFactory.getLogger(RequiredKeysCache.class);

    private final KeyValueStore<K, V> store;
    private final Set<K> requiredKeys = Sets.newConcurrentHashSet();

    /**
     * Guards removals and registrations of required keys, so that a key is never removed
     * between being checked and being registered
     */
    private final Lock requiredKeysLock = new ReentrantLock();

    /**
     * Creates a cache where all the initial keys are required
     */
    public RequiredKeysCache(final Map<K, V> initialValues) {
        this(initialValues.keySet(), initialValues);
    }

    /**
     * @throws com.dimosr.cache.exceptions.MissingKeysException if any of the required keys is not in the initial values
     */
    public RequiredKeysCache(final Set<K> requiredKeys, final Map<K, V> initialValues) {
        this.store = new KeyValueStore<>(initialValues);
        store.require(requiredKeys);
        this.requiredKeys.addAll(requiredKeys);
    }

    @Override
    protected KeyValueStore<K, V> delegate() {
        return store;
    }

    @Override
    public void remove(final K key) {
        requiredKeysLock.lock();
        try {
            if(requiredKeys.contains(key)) {
                log.debug("Ignored removal of required key {}", key);
                return;
            }
            store.remove(key);
        } finally {
            requiredKeysLock.unlock();
        }
    }

    @Override
    public RequiredKeysCache<K, V> require(final K key) {
        super.require(key);
        return this;
    }

    @Override
    public RequiredKeysCache<K, V> require(final Set<K> keys) {
        super.require(keys);
        return this;
    }

    /**
     * Registers a further required key
     *
     * @throws com.dimosr.cache.exceptions.MissingKeysException if the key is not in the cache
     */
    public RequiredKeysCache<K, V> addRequiredKey(final K key) {
        requiredKeysLock.lock();
        try {
            store.require(key);
            requiredKeys.add(key);
        } finally {
            requiredKeysLock.unlock();
        }
        return this;
    }

    public Set<K> getRequiredKeys() {
        return ImmutableSet.copyOf(requiredKeys);
    }

    /**
     * @throws IllegalArgumentException if the key is not a required key
     * @throws com.dimosr.cache.exceptions.InvalidTypeException if the value is not of the given type
     */
    public <T> T resolveRequired(final K key, final Class<T> type) {
        checkArgument(requiredKeys.contains(key), "The key '%s' is not a required key", key);
        return store.resolve(key, type);
    }

    /**
     * Replaces the value of a required key with the result of the given function applied on the current value.
     * Not atomic with regards to other writers of the same key.
     *
     * @return the new value
     */
    public <T> V update(final K key, final Class<T> type, final Function<? super T, ? extends V> update) {
        V newValue = update.apply(resolveRequired(key, type));
        store.set(key, newValue);
        return newValue;
    }

    /**
     * @return the result of the given function applied on the value of the required key
     */
    public <T, R> R use(final K key, final Class<T> type, final Function<? super T, ? extends R> function) {
        return function.apply(resolveRequired(key, type));
    }

    public void addListener(final CacheListener<K, V> listener) {
        store.addListener(listener);
    }

    public void removeListener(final CacheListener<K, V> listener) {
        store.removeListener(listener);
    }
}
