package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.dimosr.cache.exceptions.InvalidTypeException;
import com.dimosr.cache.exceptions.MissingKeysException;
import com.dimosr.cache.util.TypeCasts;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A pipeline of caches (stages), queried in the order given at construction.
 *
 * The stages can be of any kind and hold keys and values of any type, since they are type-erased
 * through {@link AnyCacheable}. Each stage keeps its own entries and its own lock; the pipeline
 * has no state of its own besides the fixed list of stages.
 *
 * <pre>
 * -------------------------------------------------
 * |  get / resolve: first stage with a match wins  |
 * -------------------------------------------------
 * |        Stage 0 (e.g. an LRUCache)              |
 * -------------------------------------------------
 * |        Stage 1 (e.g. an ExpiringCache)         |
 * -------------------------------------------------
 * |        ...                                     |
 * -------------------------------------------------
 * </pre>
 *
 * - Reads go through the stages in order. A stage holding a value of the wrong type counts as a miss,
 *   and the next stage is tried.
 * - Writes and removals are applied to every stage, so right after a write all the stages hold the key.
 *   A write that any stage cannot hold, due to the type of its key or value, is rejected as a whole.
 *   The stages may later diverge, due to their own eviction or expiry policies.
 * - {@code contains} is true if any stage holds the key.
 * - {@code require} checks every stage and reports the union of the keys missing from any of them.
 * - {@code valuesOfType} returns the snapshot of the first stage that has matching values.
 *   It does not merge the stages.
 */
public class ComposableCache<K> implements Cacheable<K, Object> {
    private static final Logger log = LoggerFactory.getLogger(ComposableCache.class);

    private final Class<K> keyType;
    private final List<AnyCacheable> stages;

    /**
     * @param keyType the type of the keys of the pipeline. Keys of other types held by a stage are not
     *                part of the pipeline's snapshots
     * @param stages the stages, in the order they are queried
     */
    public ComposableCache(final Class<K> keyType, final List<AnyCacheable> stages) {
        checkArgument(!stages.isEmpty(), "A composable cache needs at least one stage");
        this.keyType = checkNotNull(keyType, "keyType");
        this.stages = ImmutableList.copyOf(stages);
    }

    /**
     * Creates a pipeline with a single {@link KeyValueStore} stage seeded with the given values
     */
    public ComposableCache(final Class<K> keyType, final Map<K, Object> initialValues) {
        this(keyType, ImmutableList.of(new AnyCacheable(ImmutableMap.<Object, Object>copyOf(initialValues))));
    }

    public static <K> ComposableCache<K> of(final Class<K> keyType, final AnyCacheable... stages) {
        return new ComposableCache<>(keyType, Arrays.asList(stages));
    }

    @Override
    public Optional<Object> get(final K key) {
        return get(key, Object.class);
    }

    @Override
    public <T> Optional<T> get(final K key, final Class<T> type) {
        for(int i = 0; i < stages.size(); i++) {
            Optional<T> value = stages.get(i).get(key, type);
            if(value.isPresent()) {
                log.trace("Key {} found in stage {}", key, i);
                return value;
            }
        }
        return Optional.empty();
    }

    @Override
    public Object resolve(final K key) {
        return resolve(key, Object.class);
    }

    @Override
    public <T> T resolve(final K key, final Class<T> type) {
        return get(key, type).orElseThrow(() -> MissingKeysException.forKey(key));
    }

    /**
     * @throws InvalidTypeException if any of the stages cannot hold the key or the value,
     *         in which case no stage is written
     */
    @Override
    public void set(final K key, final Object value) {
        for(AnyCacheable stage : stages) {
            stage.checkWritable(key, value);
        }
        for(AnyCacheable stage : stages) {
            stage.set(key, value);
        }
    }

    @Override
    public void remove(final K key) {
        for(AnyCacheable stage : stages) {
            stage.remove(key);
        }
    }

    @Override
    public boolean contains(final K key) {
        for(AnyCacheable stage : stages) {
            if(stage.contains(key)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public ComposableCache<K> require(final K key) {
        return require(ImmutableSet.of(key));
    }

    @Override
    public ComposableCache<K> require(final Set<K> keys) {
        Set<Object> erasedKeys = ImmutableSet.copyOf(keys);
        Set<Object> missingKeys = Sets.newHashSet();
        for(AnyCacheable stage : stages) {
            try {
                stage.require(erasedKeys);
            } catch(MissingKeysException e) {
                missingKeys.addAll(e.getKeys());
            }
        }

        if(!missingKeys.isEmpty()) {
            throw new MissingKeysException(missingKeys);
        }
        return this;
    }

    /**
     * First match wins: the values of the first stage with at least one value of the type
     */
    @Override
    public <T> Map<K, T> valuesOfType(final Class<T> type) {
        for(AnyCacheable stage : stages) {
            Map<K, T> values = keysOfThisPipeline(stage.valuesOfType(type));
            if(!values.isEmpty()) {
                return values;
            }
        }
        return ImmutableMap.of();
    }

    @Override
    public Map<K, Object> allValues() {
        return valuesOfType(Object.class);
    }

    public List<AnyCacheable> getStages() {
        return stages;
    }

    public Class<K> getKeyType() {
        return keyType;
    }

    private <T> Map<K, T> keysOfThisPipeline(final Map<Object, T> values) {
        ImmutableMap.Builder<K, T> pipelineValues = ImmutableMap.builder();
        for(Map.Entry<Object, T> entry : values.entrySet()) {
            TypeCasts.tryCast(entry.getKey(), keyType)
                    .ifPresent(key -> pipelineValues.put(key, entry.getValue()));
        }
        return pipelineValues.build();
    }
}
