package com.questrail.assetcodec.observability;

import com.questrail.assetcodec.api.ParseDiagnostic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CodecObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCodecObservabilitySink implements CodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);

    @Override
    public void onRegistryChange(RegistryChangeEvent event) {
        log.info("Codec registry {}: {} (priority {}) for {}",
            event.kind(), event.codecName(), event.priority(), event.typeIds());
    }

    @Override
    public void onDegradedParse(DegradedParseEvent event) {
        if (!event.isDegrading()) {
            log.debug("Parsed {} with {} with notes: {}", event.typeId(), event.codecName(), event.diagnostics());
            return;
        }
        log.warn("Degraded parse of {} by {} ({} diagnostics)",
            event.typeId(), event.codecName(), event.diagnostics().size());
        for (ParseDiagnostic d : event.diagnostics()) {
            log.warn("  section '{}' at offset {}: {} - {}", d.section(), d.offset(), d.reason(), d.detail());
        }
    }

    @Override
    public void onResolutionMiss(ResolutionMissEvent event) {
        log.debug("No codec registered for {}", event.typeId());
    }

    @Override
    public void onError(CodecErrorEvent event) {
        log.error("Codec error for {}: {}", event.typeId(), event.message(), event.cause());
    }
}
