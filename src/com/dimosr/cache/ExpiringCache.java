package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.dimosr.cache.exceptions.ExpiredKeyException;
import com.dimosr.cache.exceptions.MissingKeysException;
import com.dimosr.cache.util.TypeCasts;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A cache whose entries expire a fixed duration after they were written.
 *
 * The duration is configured once, at construction, and applies to every write.
 * Expired entries are evicted lazily: an expired entry stays in the underlying store until
 * a {@code get}, {@code resolve}, {@code contains} or {@code require} observes it,
 * at which point it is removed and reported as absent. The snapshot methods
 * ({@code valuesOfType}, {@code allValues}) skip expired entries without removing them.
 *
 * {@code resolve} reports an expired entry with an {@link ExpiredKeyException},
 * so that callers can tell it apart from a key that was never there.
 *
 * An entry is expired from its expiration instant onwards, so with a duration of zero
 * every entry is already expired when it is read back.
 */
public class ExpiringCache<K, V> implements Cacheable<K, V> {
    private static final Logger log = LoggerFactory.getLogger(ExpiringCache.class);

    private static final ExpirationDuration DEFAULT_DURATION = ExpirationDuration.hours(1);

    private final Cacheable<K, ExpiringValue<V>> store;
    private final ExpirationDuration duration;
    private final Duration timeToLive;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();

    public ExpiringCache(final ExpirationDuration duration) {
        this(duration, Collections.emptyMap());
    }

    /**
     * Creates a cache with entries living for one hour
     */
    public ExpiringCache(final Map<K, V> initialValues) {
        this(DEFAULT_DURATION, initialValues);
    }

    public ExpiringCache(final ExpirationDuration duration, final Map<K, V> initialValues) {
        this(duration, Clock.systemUTC(), initialValues);
    }

    public ExpiringCache(final ExpirationDuration duration, final Clock clock) {
        this(duration, clock, Collections.emptyMap());
    }

    /**
     * @param duration how long each entry lives after it is written
     * @param clock the clock used to timestamp the entries and check their expiration
     * @param initialValues entries to seed the cache with, expiring {@code duration} from now
     */
    public ExpiringCache(final ExpirationDuration duration, final Clock clock, final Map<K, V> initialValues) {
        this(duration, clock, new KeyValueStore<>(), initialValues);
    }

    /**
     * Layers the policy on the given store of timestamped values, which from now on
     * must only be accessed through this cache
     */
    ExpiringCache(final ExpirationDuration duration,
                  final Clock clock,
                  final Cacheable<K, ExpiringValue<V>> store,
                  final Map<K, V> initialValues) {
        this.duration = checkNotNull(duration, "duration");
        this.timeToLive = duration.toDuration();
        this.clock = checkNotNull(clock, "clock");
        this.store = checkNotNull(store, "store");

        Instant expiration = clock.instant().plus(timeToLive);
        for(Map.Entry<K, V> entry : initialValues.entrySet()) {
            store.set(entry.getKey(), new ExpiringValue<>(entry.getValue(), expiration));
        }
    }

    @Override
    public Optional<V> get(final K key) {
        lock.lock();
        try {
            return lookupLive(key).map(ExpiringValue::getValue);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> Optional<T> get(final K key, final Class<T> type) {
        return get(key).flatMap(value -> TypeCasts.tryCast(value, type));
    }

    @Override
    public V resolve(final K key) {
        return resolveLive(key).getValue();
    }

    @Override
    public <T> T resolve(final K key, final Class<T> type) {
        return TypeCasts.cast(resolveLive(key).getValue(), type);
    }

    @Override
    public void set(final K key, final V value) {
        lock.lock();
        try {
            store.set(key, new ExpiringValue<>(value, clock.instant().plus(timeToLive)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(final K key) {
        lock.lock();
        try {
            store.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Note that this evicts the entry if it has expired
     */
    @Override
    public boolean contains(final K key) {
        lock.lock();
        try {
            return lookupLive(key).isPresent();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ExpiringCache<K, V> require(final K key) {
        return require(ImmutableSet.of(key));
    }

    @Override
    public ExpiringCache<K, V> require(final Set<K> keys) {
        ImmutableSet.Builder<K> missingKeys = ImmutableSet.builder();
        lock.lock();
        try {
            for(K key : keys) {
                if(!lookupLive(key).isPresent()) {
                    missingKeys.add(key);
                }
            }
        } finally {
            lock.unlock();
        }

        Set<K> missing = missingKeys.build();
        if(!missing.isEmpty()) {
            throw new MissingKeysException(missing);
        }
        return this;
    }

    @Override
    public <T> Map<K, T> valuesOfType(final Class<T> type) {
        Instant now = clock.instant();
        ImmutableMap.Builder<K, T> values = ImmutableMap.builder();
        for(Map.Entry<K, ExpiringValue<V>> entry : store.allValues().entrySet()) {
            ExpiringValue<V> expiringValue = entry.getValue();
            if(!expiringValue.isExpiredAt(now)) {
                TypeCasts.tryCast(expiringValue.getValue(), type)
                        .ifPresent(value -> values.put(entry.getKey(), value));
            }
        }
        return values.build();
    }

    @Override
    public Map<K, V> allValues() {
        Instant now = clock.instant();
        ImmutableMap.Builder<K, V> values = ImmutableMap.builder();
        for(Map.Entry<K, ExpiringValue<V>> entry : store.allValues().entrySet()) {
            if(!entry.getValue().isExpiredAt(now)) {
                values.put(entry.getKey(), entry.getValue().getValue());
            }
        }
        return values.build();
    }

    public ExpirationDuration getDuration() {
        return duration;
    }

    /**
     * Must be called while holding the lock
     */
    private Optional<ExpiringValue<V>> lookupLive(final K key) {
        Optional<ExpiringValue<V>> expiringValue = store.get(key);
        if(expiringValue.isPresent() && expiringValue.get().isExpiredAt(clock.instant())) {
            evict(key, expiringValue.get());
            return Optional.empty();
        }
        return expiringValue;
    }

    /**
     * Single lookup under the lock, telling a missing key apart from an expired one
     */
    private ExpiringValue<V> resolveLive(final K key) {
        lock.lock();
        try {
            ExpiringValue<V> expiringValue = store.get(key)
                    .orElseThrow(() -> MissingKeysException.forKey(key));
            if(expiringValue.isExpiredAt(clock.instant())) {
                evict(key, expiringValue);
                throw new ExpiredKeyException(key, expiringValue.getExpiration());
            }
            return expiringValue;
        } finally {
            lock.unlock();
        }
    }

    private void evict(final K key, final ExpiringValue<V> expiringValue) {
        store.remove(key);
        log.debug("Key {} expired at {}, evicted it", key, expiringValue.getExpiration());
    }
}
