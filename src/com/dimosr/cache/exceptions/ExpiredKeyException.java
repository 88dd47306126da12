package com.dimosr.cache.exceptions;

import java.time.Instant;

/**
 * An exception denoting that a key was present, but its value has expired
 *
 * This is distinct from {@link MissingKeysException}, so that callers can tell
 * a value that never existed apart from one that timed out
 */
public class ExpiredKeyException extends RuntimeException {
    private final Object key;
    private final Instant expiration;

    public ExpiredKeyException(final Object key, final Instant expiration) {
        super(String.format("Expired Key: %s (expired at %s)", key, expiration));
        this.key = key;
        this.expiration = expiration;
    }

    public Object getKey() {
        return key;
    }

    public Instant getExpiration() {
        return expiration;
    }
}
