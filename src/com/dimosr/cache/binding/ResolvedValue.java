package com.dimosr.cache.binding;

import com.dimosr.cache.RequiredKeysCache;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A handle to a dependency stored under a required key of a {@link RequiredKeysCache}
 *
 * Creating the handle registers the key as required, so the dependency must already be in the cache.
 */
public class ResolvedValue<K, T> {
    private final RequiredKeysCache<K, ? super T> cache;
    private final K key;
    private final Class<T> type;

    /**
     * @throws com.dimosr.cache.exceptions.MissingKeysException if the key is not in the cache
     */
    public ResolvedValue(final RequiredKeysCache<K, ? super T> cache, final K key, final Class<T> type) {
        this.cache = checkNotNull(cache, "cache");
        this.key = checkNotNull(key, "key");
        this.type = checkNotNull(type, "type");
        cache.addRequiredKey(key);
    }

    /**
     * @throws com.dimosr.cache.exceptions.InvalidTypeException if the dependency is not of the expected type
     */
    public T get() {
        return cache.resolveRequired(key, type);
    }

    public void set(final T value) {
        cache.set(key, value);
    }

    public K getKey() {
        return key;
    }
}
