package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.dimosr.cache.exceptions.InvalidTypeException;
import com.dimosr.cache.exceptions.MissingKeysException;
import com.dimosr.cache.util.TypeCasts;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A type-erased view of a cache, so that caches with different key and value types
 * can be used side by side (e.g. as the stages of a {@link ComposableCache}).
 *
 * Keys and values are checked against the types of the wrapped cache at runtime:
 * - a key of the wrong type is treated as absent (reads miss, {@code resolve}/{@code require} report it missing)
 * - a write whose key or value has the wrong type fails with an {@link InvalidTypeException}
 */
public final class AnyCacheable implements Cacheable<Object, Object> {
    private final TypedCache<?, ?> cache;

    private AnyCacheable(final TypedCache<?, ?> cache) {
        this.cache = cache;
    }

    /**
     * Creates a view over a new {@link KeyValueStore} seeded with the given values
     */
    public AnyCacheable(final Map<Object, Object> initialValues) {
        this(new TypedCache<>(new KeyValueStore<>(initialValues), Object.class, Object.class));
    }

    /**
     * @param cache the cache to wrap
     * @param keyType the type of the keys of the wrapped cache
     * @param valueType the type of the values of the wrapped cache
     */
    public static <K, V> AnyCacheable of(final Cacheable<K, V> cache, final Class<K> keyType, final Class<V> valueType) {
        return new AnyCacheable(new TypedCache<>(cache, keyType, valueType));
    }

    @Override
    public Optional<Object> get(final Object key) {
        return cache.get(key);
    }

    @Override
    public <T> Optional<T> get(final Object key, final Class<T> type) {
        return cache.get(key, type);
    }

    @Override
    public Object resolve(final Object key) {
        return cache.resolve(key, Object.class);
    }

    @Override
    public <T> T resolve(final Object key, final Class<T> type) {
        return cache.resolve(key, type);
    }

    /**
     * @throws InvalidTypeException if the key or the value is not of the type of the wrapped cache
     */
    @Override
    public void set(final Object key, final Object value) {
        cache.set(key, value);
    }

    /**
     * Checks that a write of the key and value would be accepted, without performing it
     *
     * @throws InvalidTypeException if the key or the value is not of the type of the wrapped cache
     */
    void checkWritable(final Object key, final Object value) {
        cache.checkWritable(key, value);
    }

    @Override
    public void remove(final Object key) {
        cache.remove(key);
    }

    @Override
    public boolean contains(final Object key) {
        return cache.contains(key);
    }

    @Override
    public AnyCacheable require(final Object key) {
        return require(ImmutableSet.of(key));
    }

    @Override
    public AnyCacheable require(final Set<Object> keys) {
        cache.require(keys);
        return this;
    }

    @Override
    public <T> Map<Object, T> valuesOfType(final Class<T> type) {
        return cache.valuesOfType(type);
    }

    @Override
    public Map<Object, Object> allValues() {
        return cache.valuesOfType(Object.class);
    }

    /**
     * @return the wrapped cache
     */
    public Cacheable<?, ?> unwrap() {
        return cache.delegate;
    }

    @Override
    public String toString() {
        return "AnyCacheable(" + cache.delegate + ")";
    }

    /**
     * Keeps the type parameters of the wrapped cache, so that untyped keys and values
     * can be checked before reaching it
     */
    private static final class TypedCache<K, V> {
        private final Cacheable<K, V> delegate;
        private final Class<K> keyType;
        private final Class<V> valueType;

        private TypedCache(final Cacheable<K, V> delegate, final Class<K> keyType, final Class<V> valueType) {
            this.delegate = checkNotNull(delegate, "cache");
            this.keyType = checkNotNull(keyType, "keyType");
            this.valueType = checkNotNull(valueType, "valueType");
        }

        private Optional<Object> get(final Object key) {
            return toKey(key).flatMap(delegate::get).map(value -> (Object) value);
        }

        private <T> Optional<T> get(final Object key, final Class<T> type) {
            return toKey(key).flatMap(typedKey -> delegate.get(typedKey, type));
        }

        private <T> T resolve(final Object key, final Class<T> type) {
            K typedKey = toKey(key).orElseThrow(() -> MissingKeysException.forKey(key));
            return delegate.resolve(typedKey, type);
        }

        private void set(final Object key, final Object value) {
            checkWritable(key, value);
            delegate.set(TypeCasts.cast(key, keyType), TypeCasts.cast(value, valueType));
        }

        private void checkWritable(final Object key, final Object value) {
            checkNotNull(key, "key");
            checkNotNull(value, "value");
            TypeCasts.cast(key, keyType);
            TypeCasts.cast(value, valueType);
        }

        private void remove(final Object key) {
            toKey(key).ifPresent(delegate::remove);
        }

        private boolean contains(final Object key) {
            return toKey(key).map(delegate::contains).orElse(false);
        }

        private void require(final Set<Object> keys) {
            Set<Object> missingKeys = Sets.newHashSet();
            ImmutableSet.Builder<K> typedKeys = ImmutableSet.builder();
            for(Object key : keys) {
                Optional<K> typedKey = toKey(key);
                if(typedKey.isPresent()) {
                    typedKeys.add(typedKey.get());
                } else {
                    missingKeys.add(key);
                }
            }

            try {
                delegate.require(typedKeys.build());
            } catch(MissingKeysException e) {
                missingKeys.addAll(e.getKeys());
            }

            if(!missingKeys.isEmpty()) {
                throw new MissingKeysException(missingKeys);
            }
        }

        private <T> Map<Object, T> valuesOfType(final Class<T> type) {
            return ImmutableMap.<Object, T>copyOf(delegate.valuesOfType(type));
        }

        private Optional<K> toKey(final Object key) {
            return TypeCasts.tryCast(key, keyType);
        }
    }
}
