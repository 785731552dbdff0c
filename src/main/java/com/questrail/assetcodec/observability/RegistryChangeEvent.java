package com.questrail.assetcodec.observability;

import com.questrail.assetcodec.api.ResourceTypeId;

import java.time.Instant;
import java.util.Set;

/**
 * Record describing one mutation of a codec registry.
 */
public record RegistryChangeEvent(
    Instant timestamp,
    Kind kind,
    String codecName,
    Set<ResourceTypeId> typeIds,
    int priority
) {
    public RegistryChangeEvent {
        typeIds = Set.copyOf(typeIds);
    }

    public enum Kind {
        REGISTERED,
        UNREGISTERED,
        ENABLED,
        DISABLED,
        ALIAS_BOUND
    }
}
