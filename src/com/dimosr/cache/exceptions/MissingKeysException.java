package com.dimosr.cache.exceptions;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * An exception denoting that one or more requested keys are not present in a cache
 */
public class MissingKeysException extends RuntimeException {
    private final Set<Object> keys;

    public MissingKeysException(final Set<?> keys) {
        super("Missing Required Keys: " + Joiner.on(", ").join(keys));
        this.keys = ImmutableSet.<Object>copyOf(keys);
    }

    public static MissingKeysException forKey(final Object key) {
        return new MissingKeysException(ImmutableSet.of(key));
    }

    public Set<Object> getKeys() {
        return keys;
    }
}
