package com.questrail.assetcodec.api;

/**
 * Thrown by a mutating call that would introduce a second entry for a key
 * that must be unique. The call has no effect.
 */
public final class DuplicateKeyConflictException extends IllegalStateException
{
    private final String key;

    public DuplicateKeyConflictException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
