package com.questrail.assetcodec.observability;

import com.questrail.assetcodec.api.ResourceTypeId;

import java.time.Instant;

/**
 * Record representing a failed parse or serialize call.
 */
public record CodecErrorEvent(
    Instant timestamp,
    ResourceTypeId typeId,
    String message,
    Throwable cause
) {
}
