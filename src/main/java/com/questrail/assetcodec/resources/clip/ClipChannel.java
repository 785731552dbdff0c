package com.questrail.assetcodec.resources.clip;

import java.util.Arrays;
import java.util.Objects;

/**
 * One animation channel of a clip. Each tick occupies {@value #TICK_SIZE}
 * bytes that are kept opaque.
 */
public record ClipChannel(
    String channelName,
    float ticksPerFrame,
    byte[] tickData
) {
    public static final int TICK_SIZE = 12;

    public ClipChannel {
        Objects.requireNonNull(channelName, "channelName");
        Objects.requireNonNull(tickData, "tickData");
        if (tickData.length % TICK_SIZE != 0) {
            throw new IllegalArgumentException("Tick data length " + tickData.length
                    + " is not a multiple of " + TICK_SIZE);
        }
        tickData = tickData.clone();
    }

    public int numTicks() {
        return tickData.length / TICK_SIZE;
    }

    @Override
    public byte[] tickData() {
        return tickData.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ClipChannel that
                && channelName.equals(that.channelName)
                && Float.compare(ticksPerFrame, that.ticksPerFrame) == 0
                && Arrays.equals(tickData, that.tickData);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(channelName, ticksPerFrame) + Arrays.hashCode(tickData);
    }

    @Override
    public String toString() {
        return "ClipChannel[" + channelName + ", ticks=" + numTicks() + ", ticksPerFrame=" + ticksPerFrame + "]";
    }
}
