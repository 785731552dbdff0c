package com.questrail.assetcodec.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Strongly typed representation of a resource type identifier.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * Every payload in an asset archive is tagged with an opaque 32-bit value that
 * names its binary format. The value carries no structure the codec layer may
 * rely on; it is only ever compared for equality when choosing a codec.
 * </p>
 *
 * <p>
 * Treating the identifier as a raw {@code int} would allow it to be mixed with
 * format versions, name hashes and the other 32-bit quantities that fill these
 * payloads. This wrapper keeps type ids distinct in registry code and tests.
 * </p>
 *
 * <h2>Mnemonics</h2>
 * <p>
 * Some formats are commonly referred to by a short mnemonic such as
 * {@code "PRES"}. A mnemonic is descriptive metadata only: two ids with the same
 * numeric value are equal regardless of their mnemonics.
 * </p>
 */
public final class ResourceTypeId
{
    private final int value;
    private final String mnemonic;

    private ResourceTypeId(int value, String mnemonic) {
        this.value = value;
        this.mnemonic = mnemonic;
    }

    /**
     * Creates a type id for the given raw value.
     *
     * @param value the 32-bit identifier; all bit patterns are legal
     */
    public static ResourceTypeId of(int value) {
        return new ResourceTypeId(value, null);
    }

    /**
     * Creates a type id carrying a human-readable mnemonic.
     *
     * @throws IllegalArgumentException if the mnemonic is blank
     */
    public static ResourceTypeId of(int value, String mnemonic) {
        Objects.requireNonNull(mnemonic, "mnemonic");
        if (mnemonic.isBlank()) {
            throw new IllegalArgumentException("mnemonic must not be blank");
        }
        return new ResourceTypeId(value, mnemonic);
    }

    /**
     * Parses hexadecimal text such as {@code "0x4E69E952"} or {@code "4E69E952"}.
     *
     * @return the parsed id, or empty if the text is not 1-8 hex digits
     */
    public static Optional<ResourceTypeId> parseHex(String text) {
        Objects.requireNonNull(text, "text");
        String digits = text.trim();
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        }
        if (digits.isEmpty() || digits.length() > 8) {
            return Optional.empty();
        }
        try {
            return Optional.of(of(Integer.parseUnsignedInt(digits, 16)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Returns the raw 32-bit value. Callers that need the unsigned value should
     * use {@link #unsignedValue()}.
     */
    public int value() {
        return value;
    }

    public long unsignedValue() {
        return Integer.toUnsignedLong(value);
    }

    public Optional<String> mnemonic() {
        return Optional.ofNullable(mnemonic);
    }

    /**
     * Returns the canonical {@code 0xXXXXXXXX} form.
     */
    public String toHex() {
        return String.format(Locale.ROOT, "0x%08X", value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceTypeId that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return mnemonic == null
                ? "ResourceTypeId[" + toHex() + "]"
                : "ResourceTypeId[" + toHex() + " " + mnemonic + "]";
    }
}
