package com.dimosr.cache.core;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An abstraction of an in-process key-value cache
 *
 * Values are stored untyped from the point of view of the caller reading them:
 * every read path accepts the type the caller expects and the cache checks the
 * stored value against it at read time.
 *
 * How entries are retained (forever, by recency, by age) depends on each implementation.
 * All implementations are thread-safe.
 *
 * @param <K> the type of the keys, which must implement equals/hashCode
 * @param <V> the type of the stored values
 */
public interface Cacheable<K, V> {

    /**
     * @return the value stored under the key, or an empty optional if there is none
     */
    Optional<V> get(K key);

    /**
     * @return the value stored under the key cast to the given type,
     *         or an empty optional if there is no value or it is not an instance of that type
     */
    <T> Optional<T> get(K key, Class<T> type);

    /**
     * Like {@link #get(Object)}, but a missing key is reported as an error
     *
     * @throws com.dimosr.cache.exceptions.MissingKeysException if there is no value for the key
     */
    V resolve(K key);

    /**
     * Like {@link #get(Object, Class)}, but failures are reported as errors
     *
     * @throws com.dimosr.cache.exceptions.MissingKeysException if there is no value for the key
     * @throws com.dimosr.cache.exceptions.InvalidTypeException if the value is not an instance of the given type
     */
    <T> T resolve(K key, Class<T> type);

    /**
     * Stores the value under the key, replacing any previous value
     */
    void set(K key, V value);

    /**
     * Removes the value stored under the key. Does nothing if there is none.
     */
    void remove(K key);

    boolean contains(K key);

    /**
     * @return this cache, so that calls can be chained
     * @throws com.dimosr.cache.exceptions.MissingKeysException if the key is missing
     */
    Cacheable<K, V> require(K key);

    /**
     * @return this cache, so that calls can be chained
     * @throws com.dimosr.cache.exceptions.MissingKeysException listing every missing key
     */
    Cacheable<K, V> require(Set<K> keys);

    /**
     * @return a snapshot of the entries whose values are instances of the given type
     */
    <T> Map<K, T> valuesOfType(Class<T> type);

    /**
     * @return a snapshot of all the entries
     */
    Map<K, V> allValues();
}
