package com.questrail.assetcodec.api;

import java.util.Objects;

/**
 * A single logical field read through {@link FieldAccess}.
 *
 * @param name  field name as listed by {@link FieldAccess#fieldNames()}
 * @param type  declared Java type of the field
 * @param value current value; may be {@code null} only for optional fields
 */
public record FieldValue(String name, Class<?> type, Object value) {
    public FieldValue {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Returns the value cast to {@code expected}.
     *
     * @throws ClassCastException if the value is not of that type
     */
    public <T> T as(Class<T> expected) {
        return expected.cast(value);
    }
}
