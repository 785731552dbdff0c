package com.questrail.assetcodec.codec;

import com.questrail.assetcodec.api.DegradationReason;

/**
 * Base type for every failure raised while reading a resource payload.
 *
 * <p>Whether a failure is fatal depends on where it happens: raised while
 * reading a mandatory header it unwinds to the {@code parse} caller; raised
 * inside an optional section it is absorbed into the instance's diagnostics
 * by {@link ParseContext#readSection}.</p>
 *
 * <p>A {@linkplain #resumable() resumable} failure leaves the reader just past
 * the rejected field, so the sections after it can still be read.</p>
 */
public abstract class ResourceParseException extends RuntimeException
{
    private final int offset;
    private final boolean resumable;

    protected ResourceParseException(String message, int offset) {
        this(message, offset, false);
    }

    protected ResourceParseException(String message, int offset, boolean resumable) {
        super(message);
        this.offset = offset;
        this.resumable = resumable;
    }

    protected ResourceParseException(String message, int offset, Throwable cause, boolean resumable) {
        super(message, cause);
        this.offset = offset;
        this.resumable = resumable;
    }

    /**
     * Byte offset within the payload at which the failure was detected.
     */
    public int offset() {
        return offset;
    }

    /**
     * Whether the reader was left positioned just past the rejected field.
     * When false the reader's position says nothing about where the next
     * section starts.
     */
    public boolean resumable() {
        return resumable;
    }

    /**
     * Classification used when this failure degrades a section.
     */
    public abstract DegradationReason reason();
}
