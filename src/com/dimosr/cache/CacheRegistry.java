package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.google.common.collect.ImmutableSet;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A holder of the caches shared across an application.
 *
 * It provides:
 * - a general purpose cache of arbitrary keys and values
 * - a cache of dependencies, whose keys are all required
 * - any number of further caches registered under a name
 *
 * There is no static instance: an application creates one registry, usually at start-up,
 * and passes it explicitly to the components that need it. The registry and its caches
 * live as long as the application holds on to it and need no teardown.
 */
public class CacheRegistry {
    private final KeyValueStore<Object, Object> cache = new KeyValueStore<>();
    private final RequiredKeysCache<Object, Object> dependencies = new RequiredKeysCache<>(Collections.emptyMap());
    private final ConcurrentMap<String, Cacheable<?, ?>> namedCaches = new ConcurrentHashMap<>();

    public KeyValueStore<Object, Object> cache() {
        return cache;
    }

    public RequiredKeysCache<Object, Object> dependencies() {
        return dependencies;
    }

    /**
     * @return the given cache
     * @throws IllegalStateException if another cache is already registered under the name
     */
    public <C extends Cacheable<?, ?>> C register(final String name, final C namedCache) {
        checkNotNull(name, "name");
        checkNotNull(namedCache, "cache");
        Cacheable<?, ?> existing = namedCaches.putIfAbsent(name, namedCache);
        if(existing != null) {
            throw new IllegalStateException("A cache is already registered under the name: " + name);
        }
        return namedCache;
    }

    /**
     * @return the cache registered under the name, if there is one and it is of the given type
     */
    public <C> Optional<C> lookup(final String name, final Class<C> type) {
        Cacheable<?, ?> namedCache = namedCaches.get(name);
        if(type.isInstance(namedCache)) {
            return Optional.of(type.cast(namedCache));
        }
        return Optional.empty();
    }

    public void unregister(final String name) {
        namedCaches.remove(name);
    }

    public Set<String> names() {
        return ImmutableSet.copyOf(namedCaches.keySet());
    }
}
