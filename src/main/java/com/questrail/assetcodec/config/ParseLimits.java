package com.questrail.assetcodec.config;

/**
 * Ceilings applied to every length or count read from an untrusted payload.
 *
 * <p>A declared value above its ceiling degrades the section that declared it;
 * storage for the section is never allocated.</p>
 *
 * @param maxSectionCount maximum number of records in one list section
 * @param maxStringLength maximum byte length of a name-like string
 * @param maxBlobLength   maximum byte length of a value string, opaque blob or trailer
 */
public record ParseLimits(
    int maxSectionCount,
    int maxStringLength,
    int maxBlobLength
) {
    public static final int DEFAULT_MAX_SECTION_COUNT = 1_000;
    public static final int DEFAULT_MAX_STRING_LENGTH = 1_024;
    public static final int DEFAULT_MAX_BLOB_LENGTH = 16 * 1024 * 1024;

    public ParseLimits {
        requirePositive("maxSectionCount", maxSectionCount);
        requirePositive("maxStringLength", maxStringLength);
        requirePositive("maxBlobLength", maxBlobLength);
    }

    public static ParseLimits defaults() {
        return new ParseLimits(DEFAULT_MAX_SECTION_COUNT, DEFAULT_MAX_STRING_LENGTH, DEFAULT_MAX_BLOB_LENGTH);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, was " + value);
        }
    }

    public static final class Builder {
        private int maxSectionCount = DEFAULT_MAX_SECTION_COUNT;
        private int maxStringLength = DEFAULT_MAX_STRING_LENGTH;
        private int maxBlobLength = DEFAULT_MAX_BLOB_LENGTH;

        public Builder withMaxSectionCount(int maxSectionCount) {
            this.maxSectionCount = maxSectionCount;
            return this;
        }

        public Builder withMaxStringLength(int maxStringLength) {
            this.maxStringLength = maxStringLength;
            return this;
        }

        public Builder withMaxBlobLength(int maxBlobLength) {
            this.maxBlobLength = maxBlobLength;
            return this;
        }

        public ParseLimits build() {
            return new ParseLimits(maxSectionCount, maxStringLength, maxBlobLength);
        }
    }
}
