package com.questrail.assetcodec.api;

import java.util.concurrent.CancellationException;

/**
 * CancellationSignal
 * =============================================================================
 * Cooperative cancellation flag handed to long-running codec entry points.
 *
 * <p>
 * Codecs check the signal when they are entered and once per record of every
 * bulk section. A codec that observes cancellation throws
 * {@link CancellationException} and commits nothing: parsing builds its result
 * off to the side, and bulk mutations apply their changes only after the loop
 * has finished.
 * </p>
 *
 * <p>
 * A signal is one-shot. Once cancelled it stays cancelled.
 * </p>
 */
public final class CancellationSignal
{
    /**
     * A signal that can never be cancelled.
     */
    public static final CancellationSignal NONE = new CancellationSignal(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call moved the signal to the cancelled state;
     *         {@code false} if it was already cancelled or cannot be cancelled
     */
    public boolean cancel() {
        if (!cancellable || cancelled) {
            return false;
        }
        cancelled = true;
        return true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if cancellation has been requested
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
