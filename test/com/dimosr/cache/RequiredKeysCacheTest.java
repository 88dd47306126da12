package com.dimosr.cache;

import com.dimosr.cache.exceptions.InvalidTypeException;
import com.dimosr.cache.exceptions.MissingKeysException;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RequiredKeysCacheTest {

    private RequiredKeysCache<String, Object> cache;

    @Before
    public void setup() {
        cache = new RequiredKeysCache<>(ImmutableMap.<String, Object>of("count", 1, "name", "cache"));
    }

    @Test
    public void initialKeysAreRequired() {
        assertThat(cache.getRequiredKeys()).containsExactlyInAnyOrder("count", "name");
    }

    @Test
    public void creatingWithMissingRequiredKeysFails() {
        assertThatThrownBy(() -> new RequiredKeysCache<>(ImmutableSet.of("count", "missing"), ImmutableMap.<String, Object>of("count", 1)))
                .isInstanceOfSatisfying(MissingKeysException.class,
                        e -> assertThat(e.getKeys()).containsExactly("missing"));
    }

    @Test
    public void requiredKeysCannotBeRemoved() {
        cache.remove("count");

        assertThat(cache.contains("count")).isTrue();
    }

    @Test
    public void otherKeysCanBeRemoved() {
        cache.set("optional", true);

        cache.remove("optional");

        assertThat(cache.contains("optional")).isFalse();
    }

    @Test
    public void requiredKeysCanBeOverwritten() {
        cache.set("count", 2);

        assertThat(cache.resolveRequired("count", Integer.class)).isEqualTo(2);
    }

    @Test
    public void resolvingANonRequiredKeyIsRejected() {
        cache.set("optional", true);

        assertThatThrownBy(() -> cache.resolveRequired("optional", Boolean.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("optional");
    }

    @Test
    public void resolvingRequiredKeyWithAnotherTypeFails() {
        assertThatThrownBy(() -> cache.resolveRequired("count", String.class))
                .isInstanceOf(InvalidTypeException.class);
    }

    @Test
    public void updateReplacesTheValueWithTheResultOfTheFunction() {
        Object updated = cache.update("count", Integer.class, count -> count + 1);

        assertThat(updated).isEqualTo(2);
        assertThat(cache.get("count", Integer.class)).contains(2);
    }

    @Test
    public void useAppliesTheFunctionOnTheValue() {
        int length = cache.use("name", String.class, String::length);

        assertThat(length).isEqualTo(5);
    }

    @Test
    public void addingRequiredKeyNeedsTheKeyToBePresent() {
        cache.set("optional", true);

        cache.addRequiredKey("optional");
        cache.remove("optional");

        assertThat(cache.contains("optional")).isTrue();
        assertThatThrownBy(() -> cache.addRequiredKey("missing"))
                .isInstanceOf(MissingKeysException.class);
        assertThat(cache.getRequiredKeys()).doesNotContain("missing");
    }

    @Test
    public void requireReturnsTheCacheItself() {
        assertThat(cache.require("count").require(ImmutableSet.of("count", "name"))).isSameAs(cache);
    }

    @Test
    public void keysRegisteredAsRequiredWhileBeingRemovedStayPresent() throws Exception {
        int keys = 2000;
        for(int i = 0; i < keys; i++) {
            cache.set("key-" + i, i);
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> registering = executor.submit(() -> {
                for(int i = 0; i < keys; i++) {
                    try {
                        cache.addRequiredKey("key-" + i);
                    } catch(MissingKeysException e) {
                        /* Removed before it could be registered */
                    }
                }
            });
            Future<?> removing = executor.submit(() -> {
                for(int i = 0; i < keys; i++) {
                    cache.remove("key-" + i);
                }
            });
            registering.get(30, TimeUnit.SECONDS);
            removing.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        for(String requiredKey : cache.getRequiredKeys()) {
            assertThat(cache.contains(requiredKey)).as("required key %s", requiredKey).isTrue();
        }
    }
}
