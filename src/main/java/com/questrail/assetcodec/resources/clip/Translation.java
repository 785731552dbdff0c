package com.questrail.assetcodec.resources.clip;

/**
 * Initial-offset translation of a clip.
 */
public record Translation(float x, float y, float z) {
    public static final Translation ZERO = new Translation(0f, 0f, 0f);
}
