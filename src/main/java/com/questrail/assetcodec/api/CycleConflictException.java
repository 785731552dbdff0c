package com.questrail.assetcodec.api;

/**
 * Thrown when a structural assignment would close a cycle, for example making
 * a preset the parent of one of its own ancestors. The assignment has no effect.
 */
public final class CycleConflictException extends IllegalStateException
{
    public CycleConflictException(String message) {
        super(message);
    }
}
