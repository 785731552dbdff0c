package com.questrail.assetcodec.resources.clip;

import java.util.Objects;

/**
 * Timed event fired while a clip plays.
 */
public record ClipEvent(
    String name,
    float startTime,
    float duration,
    int eventType,
    String eventData
) {
    public ClipEvent {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(eventData, "eventData");
    }
}
