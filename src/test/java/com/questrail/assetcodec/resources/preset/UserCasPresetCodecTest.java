package com.questrail.assetcodec.resources.preset;

import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.codec.TruncatedDataException;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.testing.Hex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class UserCasPresetCodecTest
{
    private static final int FIRST_XML_OFFSET = 24;

    private final UserCasPresetCodec codec = new UserCasPresetCodec(ParseLimits.defaults());

    @Test
    void goldenPayloadRoundTrips()
    {
        byte[] golden = Hex.golden("user_cas_preset_v3");

        UserCasPresetResource res = codec.parse(golden);

        assertTrue(res.hasValidData());
        assertEquals(3, res.version());
        assertEquals(1, res.unknown1());
        assertEquals(2, res.unknown2());
        assertEquals(3, res.unknown3());
        assertEquals(List.of(new CasPreset("<a", 1, 2, 5, 3, 4, 5)), res.presets());
        assertArrayEquals(golden, codec.serialize(res));
    }

    @Test
    void countAboveLimitDegrades()
    {
        UserCasPresetResource res = codec.create();
        res.setUnknown3(3);
        res.addPreset(CasPreset.of("<a/>"));
        res.addPreset(CasPreset.of("<b/>"));
        UserCasPresetCodec strict = new UserCasPresetCodec(ParseLimits.builder().withMaxSectionCount(1).build());

        UserCasPresetResource parsed = strict.parse(codec.serialize(res));

        assertFalse(parsed.hasValidData());
        assertEquals(DegradationReason.CAPACITY_EXCEEDED, parsed.diagnostics().get(0).reason());
        assertEquals(0, parsed.count());
        assertEquals(3, parsed.unknown3());
    }

    @Test
    void shortHeaderIsFatal()
    {
        assertThrows(TruncatedDataException.class, () -> codec.parse(Hex.parse("03000000 01000000")));
    }

    @Test
    void newerVersionIsRejected()
    {
        byte[] bytes = Hex.golden("user_cas_preset_v3");
        bytes[0] = 4;

        assertThrows(ResourceFormatException.class, () -> codec.parse(bytes));
    }

    @Test
    void editedListSerializesInOrder()
    {
        UserCasPresetResource res = codec.create();
        res.addPreset(CasPreset.of("<x/>"));
        res.addPreset(CasPreset.of("<y/>"));
        res.removePreset(0);
        res.setUnknown1(0xFFFF_FFFFL);

        UserCasPresetResource parsed = codec.parse(codec.serialize(res));

        assertEquals(List.of(CasPreset.of("<y/>")), parsed.presets());
        assertEquals(0xFFFF_FFFFL, parsed.unknown1());
        assertFalse(res.isDirty());
    }

    @Test
    void loneSurrogateInXmlDegradesPresets()
    {
        byte[] bytes = Hex.golden("user_cas_preset_v3");
        bytes[FIRST_XML_OFFSET] = 0x00;
        bytes[FIRST_XML_OFFSET + 1] = (byte) 0xD8;

        UserCasPresetResource res = codec.parse(bytes);

        assertFalse(res.hasValidData());
        assertEquals(DegradationReason.MALFORMED_TEXT, res.diagnostics().get(0).reason());
        assertEquals(0, res.count());
        assertEquals(3, res.unknown3());
    }

    @Test
    void emptyPayloadGivesDefaults()
    {
        UserCasPresetResource res = codec.parse(new byte[0]);

        assertTrue(res.hasValidData());
        assertEquals(UserCasPresetResource.SUPPORTED_VERSION, res.version());
        assertEquals(0, res.count());
        assertEquals(0, res.unknown1());
        assertArrayEquals(codec.serialize(codec.create()), codec.serialize(res));
    }
}
