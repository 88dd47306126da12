package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.google.common.collect.ForwardingObject;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A cache which forwards all its method calls to another cache.
 * Subclasses override the methods they need to decorate.
 *
 * {@code require} returns this cache rather than the delegate, so that chained calls stay on the decorator.
 */
public abstract class ForwardingCacheable<K, V> extends ForwardingObject implements Cacheable<K, V> {

    protected ForwardingCacheable() {
    }

    @Override
    protected abstract Cacheable<K, V> delegate();

    @Override
    public Optional<V> get(final K key) {
        return delegate().get(key);
    }

    @Override
    public <T> Optional<T> get(final K key, final Class<T> type) {
        return delegate().get(key, type);
    }

    @Override
    public V resolve(final K key) {
        return delegate().resolve(key);
    }

    @Override
    public <T> T resolve(final K key, final Class<T> type) {
        return delegate().resolve(key, type);
    }

    @Override
    public void set(final K key, final V value) {
        delegate().set(key, value);
    }

    @Override
    public void remove(final K key) {
        delegate().remove(key);
    }

    @Override
    public boolean contains(final K key) {
        return delegate().contains(key);
    }

    @Override
    public ForwardingCacheable<K, V> require(final K key) {
        delegate().require(key);
        return this;
    }

    @Override
    public ForwardingCacheable<K, V> require(final Set<K> keys) {
        delegate().require(keys);
        return this;
    }

    @Override
    public <T> Map<K, T> valuesOfType(final Class<T> type) {
        return delegate().valuesOfType(type);
    }

    @Override
    public Map<K, V> allValues() {
        return delegate().allValues();
    }
}
