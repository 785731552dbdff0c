package com.questrail.assetcodec.resources.clip;

/**
 * Initial-offset rotation quaternion of a clip.
 */
public record Rotation(float x, float y, float z, float w) {
    public static final Rotation IDENTITY = new Rotation(0f, 0f, 0f, 1f);
}
