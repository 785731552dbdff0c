package com.questrail.assetcodec.resources.clip;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.api.ParseDiagnostic;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.codec.ResourceParseException;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.testing.Hex;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Byte-level behaviour of the versioned clip header layout.
 */
final class ClipHeaderCodecTest
{
    private static final int FIRST_SLOT_NAME_OFFSET = 94;
    private static final int EVENT_COUNT_OFFSET = 112;
    private static final int V4_NAMESPACE_COUNT_OFFSET = 44;
    private static final int V9_SURFACE_OFFSET = 44;

    private final ClipHeaderCodec codec = new ClipHeaderCodec(ParseLimits.defaults());

    @Test
    void currentVersionRoundTrips()
    {
        byte[] golden = Hex.golden("clip_v11");

        ClipHeaderResource clip = codec.parse(golden);

        assertTrue(clip.hasValidData());
        assertEquals(11, clip.version());
        assertEquals(1, clip.flags());
        assertEquals(2.0f, clip.duration());
        assertEquals(Rotation.IDENTITY, clip.rotation());
        assertEquals(new Translation(1f, 2f, 3f), clip.translation());
        assertEquals(0x11111111, clip.referenceNamespaceHash());
        assertEquals(0x22222222, clip.surfaceNamespaceHash());
        assertEquals(0x33333333, clip.surfaceJointNameHash());
        assertEquals(0x44444444, clip.surfaceChildNamespaceHash());
        assertEquals("a_Walk_Actor", clip.clipName());
        assertEquals("Actor", clip.actorName());
        assertEquals("rig", clip.rigName());
        assertEquals(List.of("ns1"), clip.explicitNamespaces());
        assertEquals(List.of(new SlotAssignment("c", 1, "a", 2)), clip.slotAssignments());
        assertEquals(List.of(new ClipEvent("ev", 0.5f, 0.25f, 3, "data")), clip.events());

        ClipChannel root = clip.primaryClipData().get(0);
        assertEquals("root", root.channelName());
        assertEquals(1, root.numTicks());
        assertEquals(30.0f, root.ticksPerFrame());
        assertTrue(clip.secondaryClipData().isEmpty());
        assertArrayEquals(new byte[] { (byte) 0xDE, (byte) 0xAD }, clip.trailingData());

        assertArrayEquals(golden, codec.serialize(clip));
    }

    @Test
    void olderVersionOmitsLaterFields()
    {
        byte[] golden = Hex.golden("clip_v9");

        ClipHeaderResource clip = codec.parse(golden);

        assertTrue(clip.hasValidData());
        assertEquals(9, clip.version());
        assertEquals(0x11111111, clip.referenceNamespaceHash());
        assertEquals(0, clip.surfaceNamespaceHash());
        assertEquals("Bob", clip.actorName());
        assertArrayEquals(golden, codec.serialize(clip));
    }

    @Test
    void raisingVersionInsertsSurfaceHashes()
    {
        byte[] v9 = Hex.golden("clip_v9");
        ClipHeaderResource clip = codec.parse(v9);

        clip.setVersion(10);
        byte[] v10 = codec.serialize(clip);

        assertEquals(v9.length + 8, v10.length);
        assertEquals(10, v10[0]);
        assertArrayEquals(Arrays.copyOfRange(v9, 4, V9_SURFACE_OFFSET), Arrays.copyOfRange(v10, 4, V9_SURFACE_OFFSET));
        assertArrayEquals(new byte[8], Arrays.copyOfRange(v10, V9_SURFACE_OFFSET, V9_SURFACE_OFFSET + 8));
        assertArrayEquals(Arrays.copyOfRange(v9, V9_SURFACE_OFFSET, v9.length),
                Arrays.copyOfRange(v10, V9_SURFACE_OFFSET + 8, v10.length));

        ClipHeaderResource reparsed = codec.parse(v10);
        assertEquals(clip.clipName(), reparsed.clipName());
        assertArrayEquals(v10, codec.serialize(reparsed));
    }

    @Test
    void loweringVersionDropsNewerFieldsFromOutput()
    {
        ClipHeaderResource clip = codec.parse(Hex.golden("clip_v11"));

        clip.setVersion(6);
        ClipHeaderResource reparsed = codec.parse(codec.serialize(clip));

        assertEquals(6, reparsed.version());
        assertEquals("", reparsed.clipName());
        assertEquals(0, reparsed.surfaceNamespaceHash());
        assertEquals(0x11111111, reparsed.referenceNamespaceHash());
        assertEquals("rig", reparsed.rigName());
        assertEquals(0x22222222, clip.surfaceNamespaceHash());
    }

    @Test
    void rejectedEventCountIsSkippedAndLaterSectionsAreRead()
    {
        ClipHeaderResource source = codec.parse(Hex.golden("clip_v11"));
        source.setEvents(List.of());
        byte[] bytes = codec.serialize(source);
        Arrays.fill(bytes, EVENT_COUNT_OFFSET, EVENT_COUNT_OFFSET + 4, (byte) 0xFF);

        ClipHeaderResource clip = codec.parse(bytes);

        assertFalse(clip.hasValidData());
        List<ParseDiagnostic> diagnostics = clip.diagnostics();
        assertEquals(1, diagnostics.size());
        assertEquals("events", diagnostics.get(0).section());
        assertEquals(DegradationReason.CAPACITY_EXCEEDED, diagnostics.get(0).reason());
        assertTrue(diagnostics.get(0).degrading());

        assertTrue(clip.events().isEmpty());
        assertEquals(List.of(new SlotAssignment("c", 1, "a", 2)), clip.slotAssignments());
        assertEquals("root", clip.primaryClipData().get(0).channelName());
        assertArrayEquals(new byte[] { (byte) 0xDE, (byte) 0xAD }, clip.trailingData());
    }

    @Test
    void oversizedNamespaceListDoesNotHideLaterEvents()
    {
        ClipHeaderResource source = codec.create();
        source.setVersion(4);
        source.setEvents(List.of(new ClipEvent("ev", 0.5f, 0.25f, 3, "data")));
        byte[] bytes = codec.serialize(source);
        // 5000 namespaces, above the default section ceiling
        bytes[V4_NAMESPACE_COUNT_OFFSET] = (byte) 0x88;
        bytes[V4_NAMESPACE_COUNT_OFFSET + 1] = 0x13;

        ClipHeaderResource clip = codec.parse(bytes);

        assertEquals(List.of("explicitNamespaces"),
                clip.diagnostics().stream().map(ParseDiagnostic::section).toList());
        assertEquals(List.of(new ClipEvent("ev", 0.5f, 0.25f, 3, "data")), clip.events());
    }

    @Test
    void overlongClipNameIsSkippedAndReadingContinues()
    {
        ClipHeaderCodec strict = new ClipHeaderCodec(ParseLimits.builder().withMaxStringLength(8).build());

        ClipHeaderResource clip = strict.parse(Hex.golden("clip_v11"));

        assertFalse(clip.hasValidData());
        assertEquals(1, clip.diagnostics().size());
        assertEquals("clipName", clip.diagnostics().get(0).section());
        assertEquals(DegradationReason.CAPACITY_EXCEEDED, clip.diagnostics().get(0).reason());
        assertEquals("", clip.clipName());
        assertEquals("rig", clip.rigName());
        assertEquals(List.of("ns1"), clip.explicitNamespaces());
        assertEquals(List.of(new ClipEvent("ev", 0.5f, 0.25f, 3, "data")), clip.events());
        assertArrayEquals(new byte[] { (byte) 0xDE, (byte) 0xAD }, clip.trailingData());
    }

    @Test
    void failureInsideARecordSkipsEverythingAfter()
    {
        byte[] bytes = Hex.golden("clip_v11");
        bytes[FIRST_SLOT_NAME_OFFSET] = (byte) 0xFF;
        bytes[FIRST_SLOT_NAME_OFFSET + 1] = (byte) 0xFF;
        bytes[FIRST_SLOT_NAME_OFFSET + 2] = (byte) 0xFF;
        bytes[FIRST_SLOT_NAME_OFFSET + 3] = 0x7F;

        ClipHeaderResource clip = codec.parse(bytes);

        assertFalse(clip.hasValidData());
        List<ParseDiagnostic> diagnostics = clip.diagnostics();
        assertEquals("slotAssignments", diagnostics.get(0).section());
        assertTrue(diagnostics.get(0).degrading());
        assertEquals(List.of("events", "primaryClipData", "secondaryClipData", "trailer"),
                diagnostics.subList(1, diagnostics.size()).stream().map(ParseDiagnostic::section).toList());
        assertTrue(diagnostics.subList(1, diagnostics.size()).stream().noneMatch(ParseDiagnostic::degrading));

        assertEquals(List.of("ns1"), clip.explicitNamespaces());
        assertTrue(clip.slotAssignments().isEmpty());
        assertTrue(clip.events().isEmpty());
        assertTrue(clip.primaryClipData().isEmpty());
        assertEquals(0, clip.trailingData().length);
    }

    @Test
    void skippedStringInsideARecordStillSkipsEverythingAfter()
    {
        ClipHeaderCodec strict = new ClipHeaderCodec(ParseLimits.builder().withMaxStringLength(3).build());

        ClipHeaderResource clip = strict.parse(Hex.golden("clip_v11"));

        assertEquals(List.of("clipName", "events", "primaryClipData", "secondaryClipData", "trailer"),
                clip.diagnostics().stream().map(ParseDiagnostic::section).toList());
        assertEquals(List.of(true, true, false, false, false),
                clip.diagnostics().stream().map(ParseDiagnostic::degrading).toList());
        assertEquals("rig", clip.rigName());
        assertEquals(List.of(new SlotAssignment("c", 1, "a", 2)), clip.slotAssignments());
        assertTrue(clip.events().isEmpty());
    }

    @Test
    void degradedClipStillSerializes()
    {
        byte[] bytes = Hex.golden("clip_v11");
        Arrays.fill(bytes, FIRST_SLOT_NAME_OFFSET, FIRST_SLOT_NAME_OFFSET + 4, (byte) 0xFF);
        ClipHeaderResource clip = codec.parse(bytes);

        ClipHeaderResource again = codec.parse(codec.serialize(clip));

        assertTrue(again.hasValidData());
        assertEquals(List.of("ns1"), again.explicitNamespaces());
        assertTrue(again.slotAssignments().isEmpty());
        assertTrue(again.events().isEmpty());
    }

    @Test
    void newerVersionIsRejected()
    {
        byte[] bytes = Hex.golden("clip_v11");
        bytes[0] = 12;

        assertThrows(ResourceFormatException.class, () -> codec.parse(bytes));
    }

    @Test
    void truncatedMandatoryHeaderIsFatal()
    {
        byte[] golden = Hex.golden("clip_v9");

        assertThrows(ResourceParseException.class, () -> codec.parse(Arrays.copyOf(golden, 39)));
        assertThrows(ResourceParseException.class, () -> codec.parse(Arrays.copyOf(golden, 43)));
    }

    @Test
    void cancelledParseThrows()
    {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        assertThrows(CancellationException.class, () -> codec.parse(Hex.golden("clip_v11"), signal));
    }

    @Test
    void emptyPayloadGivesDefaultClip()
    {
        ClipHeaderResource clip = codec.parse(new byte[0]);

        assertEquals(ClipHeaderResource.SUPPORTED_VERSION, clip.version());
        assertEquals("", clip.clipName());
        assertTrue(clip.hasValidData());
    }
}
