package com.dimosr.cache;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How long the entries of an {@link ExpiringCache} live after they are written,
 * expressed in seconds, minutes or hours
 */
public final class ExpirationDuration {
    private final long amount;
    private final ChronoUnit unit;

    private ExpirationDuration(final long amount, final ChronoUnit unit) {
        checkArgument(amount >= 0, "The expiration duration cannot be negative, but it was: %s", amount);
        this.amount = amount;
        this.unit = unit;
    }

    public static ExpirationDuration seconds(final long seconds) {
        return new ExpirationDuration(seconds, ChronoUnit.SECONDS);
    }

    public static ExpirationDuration minutes(final long minutes) {
        return new ExpirationDuration(minutes, ChronoUnit.MINUTES);
    }

    public static ExpirationDuration hours(final long hours) {
        return new ExpirationDuration(hours, ChronoUnit.HOURS);
    }

    public Duration toDuration() {
        return Duration.of(amount, unit);
    }

    public long getAmount() {
        return amount;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    @Override
    public boolean equals(final Object other) {
        if(this == other) {
            return true;
        }
        if(!(other instanceof ExpirationDuration)) {
            return false;
        }
        return toDuration().equals(((ExpirationDuration) other).toDuration());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toDuration());
    }

    @Override
    public String toString() {
        return amount + " " + unit.toString().toLowerCase();
    }
}
