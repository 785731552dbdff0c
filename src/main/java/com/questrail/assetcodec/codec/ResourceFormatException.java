package com.questrail.assetcodec.codec;

import com.questrail.assetcodec.api.DegradationReason;

import java.nio.charset.CharacterCodingException;

/**
 * Indicates that a payload is not in the expected format: wrong magic,
 * unsupported version, an unknown discriminator value, or text that does not
 * decode in its declared encoding.
 */
public final class ResourceFormatException extends ResourceParseException
{
    private final DegradationReason reason;

    public ResourceFormatException(String message, int offset) {
        this(message, offset, DegradationReason.UNKNOWN_KIND);
    }

    public ResourceFormatException(String message, int offset, DegradationReason reason) {
        super(message, offset);
        this.reason = reason;
    }

    private ResourceFormatException(String message, int offset, Throwable cause) {
        super(message, offset, cause, true);
        this.reason = DegradationReason.MALFORMED_TEXT;
    }

    /**
     * A string whose bytes do not decode strictly. The reader has already
     * skipped the string, so the failure is resumable.
     */
    public static ResourceFormatException malformedText(String encoding, int offset, CharacterCodingException cause) {
        return new ResourceFormatException(
                "Malformed " + encoding + " text at offset " + offset, offset, cause);
    }

    public static ResourceFormatException unsupportedVersion(String format, long version, long supported) {
        return new ResourceFormatException(
                "Unsupported " + format + " version: " + version + " (supported: <= " + supported + ")", 0);
    }

    @Override
    public DegradationReason reason() {
        return reason;
    }
}
