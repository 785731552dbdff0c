package com.questrail.assetcodec.observability;

/**
 * No-op implementation of CodecObservabilitySink.
 */
public final class NullObservabilitySink implements CodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRegistryChange(RegistryChangeEvent event) {}

    @Override
    public void onDegradedParse(DegradedParseEvent event) {}

    @Override
    public void onResolutionMiss(ResolutionMissEvent event) {}

    @Override
    public void onError(CodecErrorEvent event) {}
}
