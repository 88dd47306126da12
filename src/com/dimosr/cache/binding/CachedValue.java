package com.dimosr.cache.binding;

import com.dimosr.cache.core.Cacheable;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A handle to the value stored under a fixed key of a cache,
 * which can be kept in a field and read or written like a property
 *
 * @param <K> the type of the keys of the cache
 * @param <T> the type of the value under the key
 */
public class CachedValue<K, T> {
    private final Cacheable<K, ? super T> cache;
    private final K key;
    private final Class<T> type;

    public CachedValue(final Cacheable<K, ? super T> cache, final K key, final Class<T> type) {
        this.cache = checkNotNull(cache, "cache");
        this.key = checkNotNull(key, "key");
        this.type = checkNotNull(type, "type");
    }

    /**
     * @return the value, or an empty optional if the key is missing or holds a value of another type
     */
    public Optional<T> get() {
        return cache.get(key, type);
    }

    public T getOrDefault(final T defaultValue) {
        return get().orElse(defaultValue);
    }

    public void set(final T value) {
        cache.set(key, value);
    }

    public void clear() {
        cache.remove(key);
    }

    public boolean isPresent() {
        return cache.contains(key);
    }

    public K getKey() {
        return key;
    }
}
