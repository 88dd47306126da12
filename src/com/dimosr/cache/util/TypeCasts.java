package com.dimosr.cache.util;

import com.dimosr.cache.exceptions.InvalidTypeException;
import com.google.common.primitives.Primitives;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checked conversion of untyped cache values to the type requested by the caller
 *
 * Primitive class tokens are treated as their wrapper types, so that
 * {@code int.class} matches a stored {@link Integer}
 */
public final class TypeCasts {

    private TypeCasts() {
    }

    public static <T> Optional<T> tryCast(final Object value, final Class<T> type) {
        Class<T> wrappedType = Primitives.wrap(type);
        if(wrappedType.isInstance(value)) {
            return Optional.of(wrappedType.cast(value));
        }

        return Optional.empty();
    }

    /**
     * @throws InvalidTypeException if the value is not an instance of the type
     */
    public static <T> T cast(final Object value, final Class<T> type) {
        return tryCast(value, type)
                .orElseThrow(() -> new InvalidTypeException(type, value.getClass()));
    }

    /**
     * @return a new map with only the entries whose values are instances of the type
     */
    public static <K, T> Map<K, T> filterByType(final Map<K, ?> values, final Class<T> type) {
        Map<K, T> filtered = new LinkedHashMap<>();
        for(Map.Entry<K, ?> entry : values.entrySet()) {
            tryCast(entry.getValue(), type).ifPresent(value -> filtered.put(entry.getKey(), value));
        }
        return filtered;
    }
}
