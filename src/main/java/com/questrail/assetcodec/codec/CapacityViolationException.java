package com.questrail.assetcodec.codec;

import com.questrail.assetcodec.api.DegradationReason;

/**
 * Indicates that a declared count or length exceeded the configured ceiling.
 * Raised before any storage for the section is allocated.
 */
public final class CapacityViolationException extends ResourceParseException
{
    private final long declared;
    private final long limit;

    public CapacityViolationException(String what, int offset, long declared, long limit) {
        this(what, offset, declared, limit, false);
    }

    public CapacityViolationException(String what, int offset, long declared, long limit, boolean resumable) {
        super(what + " declares " + declared + " (limit " + limit + ") at offset " + offset, offset, resumable);
        this.declared = declared;
        this.limit = limit;
    }

    public long declared() {
        return declared;
    }

    public long limit() {
        return limit;
    }

    @Override
    public DegradationReason reason() {
        return DegradationReason.CAPACITY_EXCEEDED;
    }
}
