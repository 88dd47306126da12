package com.dimosr.cache;

import com.dimosr.cache.exceptions.InvalidTypeException;
import com.dimosr.cache.exceptions.MissingKeysException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

public class ComposableCacheTest {

    private LRUCache<String, Object> firstStage;
    private KeyValueStore<String, String> secondStage;

    private ComposableCache<String> cache;

    @Before
    public void setup() {
        firstStage = new LRUCache<>(2);
        secondStage = new KeyValueStore<>();
        cache = ComposableCache.of(String.class,
                AnyCacheable.of(firstStage, String.class, Object.class),
                AnyCacheable.of(secondStage, String.class, String.class)
        );
    }

    @Test
    public void setWritesToEveryStage() {
        cache.set("key", "value");

        assertThat(firstStage.get("key")).contains("value");
        assertThat(secondStage.get("key")).contains("value");
    }

    @Test
    public void setIsRejectedWhenAStageCannotHoldTheValue() {
        assertThatThrownBy(() -> cache.set("number", 1))
                .isInstanceOfSatisfying(InvalidTypeException.class, e -> {
                    assertThat(e.getExpectedType()).isEqualTo(String.class);
                    assertThat(e.getActualType()).isEqualTo(Integer.class);
                });

        assertThat(firstStage.contains("number")).isFalse();
        assertThat(secondStage.contains("number")).isFalse();
    }

    @Test
    public void setIsRejectedWhenAStageCannotHoldTheKey() {
        KeyValueStore<Integer, Object> integerKeyed = new KeyValueStore<>();
        ComposableCache<Object> pipeline = ComposableCache.of(Object.class,
                AnyCacheable.of(firstStage, String.class, Object.class),
                AnyCacheable.of(integerKeyed, Integer.class, Object.class)
        );

        assertThatThrownBy(() -> pipeline.set("key", "value"))
                .isInstanceOf(InvalidTypeException.class);
        assertThat(firstStage.contains("key")).isFalse();
    }

    @Test
    public void getFallsBackToLaterStages() {
        secondStage.set("key", "from second stage");

        assertThat(cache.get("key")).contains("from second stage");
        assertThat(cache.resolve("key", String.class)).isEqualTo("from second stage");
    }

    @Test
    public void earlierStageTakesPrecedence() {
        firstStage.set("key", "from first stage");
        secondStage.set("key", "from second stage");

        assertThat(cache.get("key", String.class)).contains("from first stage");
    }

    @Test
    public void typeMismatchInAStageIsTreatedAsAMiss() {
        firstStage.set("key", 42);
        secondStage.set("key", "text");

        assertThat(cache.get("key", String.class)).contains("text");
        assertThat(cache.resolve("key", String.class)).isEqualTo("text");
    }

    @Test
    public void resolveThrowsMissingKeysWhenNoStageMatches() {
        firstStage.set("key", 42);

        assertThatThrownBy(() -> cache.resolve("key", String.class))
                .isInstanceOfSatisfying(MissingKeysException.class,
                        e -> assertThat(e.getKeys()).containsExactly("key"));
    }

    @Test
    public void stagesMayDivergeThroughTheirOwnEviction() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");

        assertThat(firstStage.contains("a")).isFalse();
        assertThat(cache.get("a")).contains("1");
    }

    @Test
    public void removeRemovesFromEveryStage() {
        cache.set("key", "value");

        cache.remove("key");

        assertThat(firstStage.contains("key")).isFalse();
        assertThat(secondStage.contains("key")).isFalse();
        assertThat(cache.contains("key")).isFalse();
    }

    @Test
    public void containsIsTrueIfAnyStageHoldsTheKey() {
        secondStage.set("key", "value");

        assertThat(cache.contains("key")).isTrue();
        assertThat(cache.contains("missing")).isFalse();
    }

    @Test
    public void requireReportsTheUnionOfKeysMissingFromEachStage() {
        firstStage.set("a", "1");
        secondStage.set("b", "2");

        assertThatThrownBy(() -> cache.require(ImmutableSet.of("a", "b")))
                .isInstanceOfSatisfying(MissingKeysException.class,
                        e -> assertThat(e.getKeys()).containsExactlyInAnyOrder("a", "b"));
    }

    @Test
    public void requireSucceedsWhenEveryStageHoldsTheKeys() {
        cache.set("a", "1");

        assertThat(cache.require("a")).isSameAs(cache);
    }

    @Test
    public void valuesOfTypeReturnsTheFirstNonEmptyStageRatherThanAMerge() {
        firstStage.set("number", 1);
        secondStage.set("text", "value");

        assertThat(cache.valuesOfType(String.class)).containsExactly(entry("text", "value"));
        assertThat(cache.allValues()).containsExactly(entry("number", 1));
    }

    @Test
    public void snapshotsOnlyHoldKeysOfThePipelineType() {
        KeyValueStore<Object, Object> mixedKeys = new KeyValueStore<>(ImmutableMap.<Object, Object>of("text", "value", 1, "one"));
        cache = ComposableCache.of(String.class, AnyCacheable.of(mixedKeys, Object.class, Object.class));

        assertThat(cache.allValues()).containsExactly(entry("text", "value"));
        assertThat(cache.getKeyType()).isEqualTo(String.class);
    }

    @Test
    public void seededPipelineHasASingleStage() {
        cache = new ComposableCache<>(String.class, ImmutableMap.<String, Object>of("key", "value"));

        assertThat(cache.getStages()).hasSize(1);
        assertThat(cache.get("key", String.class)).contains("value");
    }

    @Test
    public void pipelineNeedsAtLeastOneStage() {
        assertThatThrownBy(() -> new ComposableCache<String>(String.class, ImmutableList.<AnyCacheable>of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
