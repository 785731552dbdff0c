package com.questrail.assetcodec.api;

import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * ResourceValue
 * -----------------------------------------------------------------------------
 * Tagged union of the value kinds stored in associative resources (key tables
 * and presets).
 *
 * <h2>Conversions</h2>
 * {@link #as(Class)} first returns the value unchanged if it already has the
 * requested Java type, then tries a narrow conversion:
 * <ul>
 *   <li>numeric to numeric, provided the value is representable</li>
 *   <li>text to number or boolean by parsing</li>
 *   <li>number or boolean to text</li>
 *   <li>bytes to and from text through Base64</li>
 * </ul>
 * A conversion that does not apply yields {@link Optional#empty()}; it never
 * throws.
 *
 * <h2>Wire form</h2>
 * {@link #toWireText()} is the text written to a payload: decimal integers,
 * {@link Double#toString(double)} for floats, {@code true}/{@code false}, and
 * Base64 for bytes.
 */
public sealed interface ResourceValue
        permits ResourceValue.TextValue, ResourceValue.IntegerValue, ResourceValue.FloatValue,
                ResourceValue.BoolValue, ResourceValue.BytesValue
{
    ValueKind kind();

    String toWireText();

    <T> Optional<T> as(Class<T> type);

    static ResourceValue text(String value) {
        return new TextValue(value);
    }

    static ResourceValue of(long value) {
        return new IntegerValue(value);
    }

    static ResourceValue of(double value) {
        return new FloatValue(value);
    }

    static ResourceValue of(boolean value) {
        return new BoolValue(value);
    }

    static ResourceValue of(byte[] value) {
        return new BytesValue(value);
    }

    /**
     * Wraps a plain Java value.
     *
     * @throws IllegalArgumentException if {@code value} is not a String, integral
     *                                  number, floating-point number, Boolean or byte[]
     */
    static ResourceValue from(Object value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof ResourceValue rv) {
            return rv;
        }
        if (value instanceof String s) {
            return new TextValue(s);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new IntegerValue(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return new FloatValue(((Number) value).doubleValue());
        }
        if (value instanceof Boolean b) {
            return new BoolValue(b);
        }
        if (value instanceof byte[] bytes) {
            return new BytesValue(bytes);
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    record TextValue(String value) implements ResourceValue
    {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.TEXT;
        }

        @Override
        public String toWireText() {
            return value;
        }

        @Override
        public <T> Optional<T> as(Class<T> type) {
            if (type == String.class) {
                return Optional.of(type.cast(value));
            }
            String s = value.trim();
            try {
                if (type == Long.class || type == Integer.class) {
                    return ResourceValue.integral(Long.parseLong(s), type);
                }
                if (type == Double.class || type == Float.class) {
                    return ResourceValue.floating(Double.parseDouble(s), type);
                }
                if (type == byte[].class) {
                    return Optional.of(type.cast(Base64.getDecoder().decode(s)));
                }
            }
            catch (IllegalArgumentException e) {
                // NumberFormatException included
                return Optional.empty();
            }
            if (type == Boolean.class) {
                String lower = s.toLowerCase(Locale.ROOT);
                if (lower.equals("true") || lower.equals("false")) {
                    return Optional.of(type.cast(Boolean.valueOf(lower)));
                }
            }
            return Optional.empty();
        }
    }

    record IntegerValue(long value) implements ResourceValue
    {
        @Override
        public ValueKind kind() {
            return ValueKind.INTEGER;
        }

        @Override
        public String toWireText() {
            return Long.toString(value);
        }

        @Override
        public <T> Optional<T> as(Class<T> type) {
            if (type == Long.class || type == Integer.class) {
                return ResourceValue.integral(value, type);
            }
            if (type == Double.class || type == Float.class) {
                return ResourceValue.floating((double) value, type);
            }
            if (type == String.class) {
                return Optional.of(type.cast(toWireText()));
            }
            return Optional.empty();
        }
    }

    record FloatValue(double value) implements ResourceValue
    {
        @Override
        public ValueKind kind() {
            return ValueKind.FLOAT;
        }

        @Override
        public String toWireText() {
            return Double.toString(value);
        }

        @Override
        public <T> Optional<T> as(Class<T> type) {
            if (type == Double.class || type == Float.class) {
                return ResourceValue.floating(value, type);
            }
            if (type == Long.class || type == Integer.class) {
                if (value != Math.rint(value) || Double.isInfinite(value)
                        || value < Long.MIN_VALUE || value > Long.MAX_VALUE) {
                    return Optional.empty();
                }
                return ResourceValue.integral((long) value, type);
            }
            if (type == String.class) {
                return Optional.of(type.cast(toWireText()));
            }
            return Optional.empty();
        }
    }

    record BoolValue(boolean value) implements ResourceValue
    {
        @Override
        public ValueKind kind() {
            return ValueKind.BOOL;
        }

        @Override
        public String toWireText() {
            return Boolean.toString(value);
        }

        @Override
        public <T> Optional<T> as(Class<T> type) {
            if (type == Boolean.class) {
                return Optional.of(type.cast(value));
            }
            if (type == String.class) {
                return Optional.of(type.cast(toWireText()));
            }
            return Optional.empty();
        }
    }

    record BytesValue(byte[] value) implements ResourceValue
    {
        public BytesValue {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public ValueKind kind() {
            return ValueKind.BYTES;
        }

        @Override
        public String toWireText() {
            return Base64.getEncoder().encodeToString(value);
        }

        @Override
        public <T> Optional<T> as(Class<T> type) {
            if (type == byte[].class) {
                return Optional.of(type.cast(value.clone()));
            }
            if (type == String.class) {
                return Optional.of(type.cast(toWireText()));
            }
            return Optional.empty();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue that && Arrays.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[" + value.length + " bytes]";
        }
    }

    private static <T> Optional<T> integral(long v, Class<T> type) {
        if (type == Long.class) {
            return Optional.of(type.cast(v));
        }
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(type.cast((int) v));
    }

    private static <T> Optional<T> floating(double v, Class<T> type) {
        if (type == Double.class) {
            return Optional.of(type.cast(v));
        }
        return Optional.of(type.cast((float) v));
    }
}
