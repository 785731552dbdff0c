package com.questrail.assetcodec.hash;

import java.util.Locale;
import java.util.Objects;

/**
 * FnvHash
 * -----------------------------------------------------------------------------
 * FNV-1 name hashing as used for namehash keys in asset payloads.
 *
 * <p>Each input byte is folded in as {@code hash = (hash * prime) ^ byte}
 * (FNV-1 order: multiply, then xor). Strings are lower-cased and encoded as
 * ASCII before hashing; characters outside ASCII hash as {@code '?'}.</p>
 *
 * <p>The 24-bit variant is the 32-bit hash with its top byte xor-folded into
 * the low 24 bits.</p>
 */
public final class FnvHash
{
    private static final int FNV32_PRIME = 0x01000193;
    private static final int FNV32_OFFSET = 0x811C9DC5;

    private static final long FNV64_PRIME = 0x00000100000001B3L;
    private static final long FNV64_OFFSET = 0xCBF29CE484222325L;

    private static final int MASK_24 = 0xFFFFFF;

    private FnvHash() {
    }

    public static int fnv32(String text) {
        return fnv32(asciiLower(text));
    }

    public static int fnv32(byte[] data) {
        Objects.requireNonNull(data, "data");
        int hash = FNV32_OFFSET;
        for (byte b : data) {
            hash *= FNV32_PRIME;
            hash ^= (b & 0xFF);
        }
        return hash;
    }

    public static int fnv24(String text) {
        int hash = fnv32(text);
        return (hash >>> 24) ^ (hash & MASK_24);
    }

    public static long fnv64(String text) {
        return fnv64(asciiLower(text));
    }

    public static long fnv64(byte[] data) {
        Objects.requireNonNull(data, "data");
        long hash = FNV64_OFFSET;
        for (byte b : data) {
            hash *= FNV64_PRIME;
            hash ^= (b & 0xFF);
        }
        return hash;
    }

    private static byte[] asciiLower(String text) {
        Objects.requireNonNull(text, "text");
        String lower = text.toLowerCase(Locale.ROOT);
        byte[] out = new byte[lower.length()];
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            out[i] = (byte) (c < 0x80 ? c : '?');
        }
        return out;
    }
}
