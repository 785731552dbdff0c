package com.questrail.assetcodec.resources.preset;

import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.api.ParseDiagnostic;
import com.questrail.assetcodec.api.ResourceValue;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.testing.Hex;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class PresetCodecTest
{
    private static final int TYPE_LENGTH_OFFSET = 8;
    private static final int B_KEY_OFFSET = 41;
    private static final int B_KIND_OFFSET = 42;

    private final PresetCodec codec = new PresetCodec(ParseLimits.defaults());

    @Test
    void goldenPresetRoundTrips()
    {
        byte[] golden = Hex.golden("preset_1_2");

        PresetResource preset = codec.parse(golden);

        assertTrue(preset.hasValidData());
        assertEquals("1.2", preset.versionString());
        assertEquals("Hair", preset.presetType());
        assertEquals("Bob", preset.presetName());
        assertEquals(List.of("a", "b"), List.copyOf(preset.data().keySet()));
        assertEquals(ResourceValue.of(7), preset.data().get("a"));
        assertEquals(ResourceValue.text("x"), preset.data().get("b"));
        assertArrayEquals(golden, codec.serialize(preset));
    }

    @Test
    void everyValueKindSurvivesSerialization()
    {
        PresetResource preset = new PresetResource("Body", "All");
        preset.setValue("s", "text with é");
        preset.setValue("i", -5);
        preset.setValue("f", 0.25);
        preset.setValue("b", true);
        preset.setValue("raw", new byte[] { 1, 2, 3 });

        PresetResource parsed = codec.parse(codec.serialize(preset));

        assertTrue(parsed.hasValidData());
        assertEquals(preset.data(), parsed.data());
        assertEquals(Optional.of(-5), parsed.getValue("i", Integer.class));
    }

    @Test
    void unknownValueKindDegradesDataOnly()
    {
        byte[] bytes = Hex.golden("preset_1_2");
        bytes[B_KIND_OFFSET] = 9;

        PresetResource preset = codec.parse(bytes);

        assertFalse(preset.hasValidData());
        assertEquals(DegradationReason.UNKNOWN_KIND, preset.diagnostics().get(0).reason());
        assertEquals("data", preset.diagnostics().get(0).section());
        assertEquals("Hair", preset.presetType());
        assertEquals(0, preset.count());
    }

    @Test
    void duplicateKeyDegradesAndLaterValueWins()
    {
        byte[] bytes = Hex.golden("preset_1_2");
        bytes[B_KEY_OFFSET] = 'a';

        PresetResource preset = codec.parse(bytes);

        assertFalse(preset.hasValidData());
        assertEquals(DegradationReason.DUPLICATE_KEY, preset.diagnostics().get(0).reason());
        assertEquals(1, preset.count());
        assertEquals(Optional.of("x"), preset.getValue("a", String.class));
    }

    @Test
    void negativeVersionIsFormatError()
    {
        byte[] bytes = Hex.golden("preset_1_2");
        bytes[3] = (byte) 0x80;

        assertThrows(ResourceFormatException.class, () -> codec.parse(bytes));
    }

    @Test
    void emptyPayloadGivesDefaults()
    {
        PresetResource preset = codec.parse(new byte[0]);

        assertTrue(preset.hasValidData());
        assertEquals("1.0", preset.versionString());
        assertEquals("Unnamed", preset.presetName());
        assertEquals(0, preset.count());
    }

    @Test
    void overlongTypeIsSkippedAndNameAndDataAreRead()
    {
        PresetCodec strict = new PresetCodec(ParseLimits.builder().withMaxStringLength(3).build());

        PresetResource preset = strict.parse(Hex.golden("preset_1_2"));

        assertFalse(preset.hasValidData());
        assertEquals(1, preset.diagnostics().size());
        assertEquals("presetType", preset.diagnostics().get(0).section());
        assertEquals(DegradationReason.CAPACITY_EXCEEDED, preset.diagnostics().get(0).reason());
        assertEquals(PresetResource.DEFAULT_TYPE, preset.presetType());
        assertEquals("Bob", preset.presetName());
        assertEquals(ResourceValue.text("x"), preset.data().get("b"));
    }

    @Test
    void typeRunningPastTheEndSkipsNameAndData()
    {
        byte[] bytes = Hex.golden("preset_1_2");
        bytes[TYPE_LENGTH_OFFSET] = (byte) 0xFF;
        bytes[TYPE_LENGTH_OFFSET + 1] = (byte) 0xFF;
        bytes[TYPE_LENGTH_OFFSET + 2] = (byte) 0xFF;
        bytes[TYPE_LENGTH_OFFSET + 3] = 0x7F;

        PresetResource preset = codec.parse(bytes);

        assertFalse(preset.hasValidData());
        assertEquals(List.of("presetType", "presetName", "data"),
                preset.diagnostics().stream().map(ParseDiagnostic::section).toList());
        assertEquals(List.of(true, false, false),
                preset.diagnostics().stream().map(ParseDiagnostic::degrading).toList());
        assertEquals("Unnamed", preset.presetName());
        assertEquals(0, preset.count());
    }
}
