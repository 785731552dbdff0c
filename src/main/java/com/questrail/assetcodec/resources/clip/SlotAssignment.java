package com.questrail.assetcodec.resources.clip;

import java.util.Objects;

/**
 * Binds an actor slot to a container slot for the duration of a clip.
 * Slot types are unsigned 32-bit values held as their bit patterns.
 */
public record SlotAssignment(
    String containerSlotName,
    int containerSlotType,
    String actorSlotName,
    int actorSlotType
) {
    public SlotAssignment {
        Objects.requireNonNull(containerSlotName, "containerSlotName");
        Objects.requireNonNull(actorSlotName, "actorSlotName");
    }
}
