package com.questrail.assetcodec.observability;

import com.questrail.assetcodec.api.ResourceTypeId;

import java.time.Instant;

/**
 * Record representing a payload for which no enabled codec was registered.
 */
public record ResolutionMissEvent(
    Instant timestamp,
    ResourceTypeId typeId
) {
}
