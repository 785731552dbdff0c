package com.questrail.assetcodec.resources.preset;

import java.util.Objects;

/**
 * One entry of a {@link UserCasPresetResource}: an XML document followed by
 * six flag fields whose meaning is not known. The flags are carried through
 * unchanged.
 *
 * @param xml      the preset body
 * @param unknown1 u8
 * @param unknown2 u8
 * @param unknown3 u32, held as its bit pattern
 * @param unknown4 u8
 * @param unknown5 u8
 * @param unknown6 u8
 */
public record CasPreset(
    String xml,
    int unknown1,
    int unknown2,
    int unknown3,
    int unknown4,
    int unknown5,
    int unknown6
) {
    public CasPreset {
        Objects.requireNonNull(xml, "xml");
        requireByte("unknown1", unknown1);
        requireByte("unknown2", unknown2);
        requireByte("unknown4", unknown4);
        requireByte("unknown5", unknown5);
        requireByte("unknown6", unknown6);
    }

    public static CasPreset of(String xml) {
        return new CasPreset(xml, 0, 0, 0, 0, 0, 0);
    }

    private static void requireByte(String name, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(name + " must fit in one unsigned byte, was " + value);
        }
    }
}
