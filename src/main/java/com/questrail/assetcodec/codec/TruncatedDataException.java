package com.questrail.assetcodec.codec;

import com.questrail.assetcodec.api.DegradationReason;

/**
 * Indicates that a read needed more bytes than the payload had left.
 */
public final class TruncatedDataException extends ResourceParseException
{
    private final long required;
    private final int available;

    public TruncatedDataException(String what, int offset, long required, int available) {
        super("Truncated " + what + " at offset " + offset
                + ": needed " + required + " bytes, " + available + " available", offset);
        this.required = required;
        this.available = available;
    }

    public long required() {
        return required;
    }

    public int available() {
        return available;
    }

    @Override
    public DegradationReason reason() {
        return DegradationReason.TRUNCATED;
    }
}
