package com.dimosr.cache;

import com.google.common.base.MoreObjects;

import java.time.Instant;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A cached value together with the instant it stops being valid
 */
public final class ExpiringValue<V> {
    private final V value;
    private final Instant expiration;

    ExpiringValue(final V value, final Instant expiration) {
        this.value = checkNotNull(value, "value");
        this.expiration = checkNotNull(expiration, "expiration");
    }

    public V getValue() {
        return value;
    }

    public Instant getExpiration() {
        return expiration;
    }

    /**
     * A value is expired from its expiration instant onwards
     */
    public boolean isExpiredAt(final Instant now) {
        return !expiration.isAfter(now);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("value", value)
                .add("expiration", expiration)
                .toString();
    }
}
