package com.questrail.assetcodec.api;

/**
 * Why an optional section of a payload was abandoned during parsing.
 */
public enum DegradationReason
{
    /** The section ran past the end of the payload. */
    TRUNCATED,

    /** A declared count or length exceeded the configured ceiling. */
    CAPACITY_EXCEEDED,

    /** A length or count field held a value that cannot describe real data. */
    INVALID_LENGTH,

    /** A discriminator inside the section held an unknown value. */
    UNKNOWN_KIND,

    /** The same key appeared more than once. */
    DUPLICATE_KEY,

    /** A string's bytes were not valid in the encoding the format declares for it. */
    MALFORMED_TEXT
}
