package com.questrail.assetcodec.observability;

import com.questrail.assetcodec.api.ParseDiagnostic;
import com.questrail.assetcodec.api.ResourceTypeId;

import java.time.Instant;
import java.util.List;

/**
 * Record representing a parse that produced an instance with diagnostics.
 */
public record DegradedParseEvent(
    Instant timestamp,
    ResourceTypeId typeId,
    String codecName,
    List<ParseDiagnostic> diagnostics
) {
    public DegradedParseEvent {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Whether any diagnostic cleared the instance's validity flag.
     */
    public boolean isDegrading() {
        return diagnostics.stream().anyMatch(ParseDiagnostic::degrading);
    }
}
