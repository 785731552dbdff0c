package com.questrail.assetcodec.resources.preset;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.config.ParseLimits;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class UserCasPresetResourceTest
{
    @Test
    void unknownHeaderFieldsAreUnsigned32Bit()
    {
        UserCasPresetResource res = new UserCasPresetResource();

        assertThrows(IllegalArgumentException.class, () -> res.setUnknown1(-1));
        assertThrows(IllegalArgumentException.class, () -> res.setUnknown2(1L << 32));
        assertFalse(res.isDirty());

        res.fields().set("Unknown3", 9);
        assertEquals(9L, res.unknown3());
        assertTrue(res.isDirty());
    }

    @Test
    void flagBytesAreRangeChecked()
    {
        assertThrows(IllegalArgumentException.class, () -> new CasPreset("", 256, 0, 0, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new CasPreset("", 0, 0, 0, 0, 0, -1));
        assertEquals(-1, new CasPreset("", 0, 0, -1, 0, 0, 0).unknown3());
    }

    @Test
    void replacingWithEqualPresetIsNoChange()
    {
        UserCasPresetResource res = new UserCasPresetResource();
        res.addPreset(CasPreset.of("<a/>"));
        new UserCasPresetCodec(ParseLimits.defaults()).serialize(res, CancellationSignal.NONE);
        assertFalse(res.isDirty());

        res.setPreset(0, CasPreset.of("<a/>"));
        assertFalse(res.isDirty());

        res.clearPresets();
        assertTrue(res.isDirty());
        assertEquals(0, res.count());
        assertFalse(res.fields().isWritable("Count"));
    }
}
