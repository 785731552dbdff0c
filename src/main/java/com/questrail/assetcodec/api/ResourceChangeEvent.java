package com.questrail.assetcodec.api;

import java.util.Objects;

/**
 * Describes one applied mutation.
 *
 * @param resource  the mutated instance
 * @param fieldName logical field (or content area, e.g. {@code "Entries"}) that changed
 */
public record ResourceChangeEvent(ResourceInstance resource, String fieldName) {
    public ResourceChangeEvent {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(fieldName, "fieldName");
    }
}
