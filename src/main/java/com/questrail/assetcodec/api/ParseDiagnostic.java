package com.questrail.assetcodec.api;

import java.util.Objects;

/**
 * A non-fatal anomaly recorded while parsing a payload.
 *
 * @param section   name of the section that was affected
 * @param reason    classification of the anomaly
 * @param offset    byte offset where the section started
 * @param detail    human-readable description
 * @param degrading whether the anomaly cleared the instance's validity flag
 */
public record ParseDiagnostic(
        String section,
        DegradationReason reason,
        int offset,
        String detail,
        boolean degrading
) {
    public ParseDiagnostic {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(detail, "detail");
    }
}
