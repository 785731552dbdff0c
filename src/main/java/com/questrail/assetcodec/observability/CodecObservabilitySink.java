package com.questrail.assetcodec.observability;

/**
 * Main interface for receiving codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the thread that produced the event and must not block.</p>
 */
public interface CodecObservabilitySink {
    /**
     * Called after a codec registry has been mutated.
     * @param event the change details
     */
    void onRegistryChange(RegistryChangeEvent event);

    /**
     * Called when a parse completed but recorded diagnostics.
     * @param event the affected type id and its diagnostics
     */
    void onDegradedParse(DegradedParseEvent event);

    /**
     * Called when no codec could be resolved for a payload.
     * @param event the unresolved type id
     */
    void onResolutionMiss(ResolutionMissEvent event);

    /**
     * Called when a parse or serialize call failed.
     * @param event the error event
     */
    void onError(CodecErrorEvent event);
}
