package com.questrail.assetcodec.codec.layout;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.api.ParseDiagnostic;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.TruncatedDataException;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.io.ResourceWriter;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.testing.Hex;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Version gating and degradation behaviour of {@link VersionedLayout}, using
 * a three-field layout where {@code extra} only exists from version 10.
 */
final class VersionedLayoutTest
{
    static final class Target {
        int base;
        int extra;
        int tail;
    }

    private static final VersionedLayout<Target> LAYOUT = VersionedLayout.<Target>builder()
            .mandatory("base", 0, (ctx, t) -> t.base = ctx.reader().readI32(), (out, s, sig) -> out.writeI32(s.base))
            .optional("extra", 10, (ctx, t) -> t.extra = ctx.reader().readI32(), (out, s, sig) -> out.writeI32(s.extra))
            .optional("tail", 0, (ctx, t) -> t.tail = ctx.reader().readI32(), (out, s, sig) -> out.writeI32(s.tail))
            .build();

    private static final VersionedLayout<Target> COUNTED = VersionedLayout.<Target>builder()
            .mandatory("base", 0, (ctx, t) -> t.base = ctx.reader().readI32(), (out, s, sig) -> out.writeI32(s.base))
            .optional("count", 0,
                    (ctx, t) -> t.extra = ctx.reader().checkCount("items", ctx.reader().readU32(), 4, 2),
                    (out, s, sig) -> out.writeU32(s.extra))
            .optional("tail", 0, (ctx, t) -> t.tail = ctx.reader().readI32(), (out, s, sig) -> out.writeI32(s.tail))
            .build();

    private static ParseContext context(String hex) {
        return new ParseContext(ResourceReader.of(Hex.parse(hex)), ParseLimits.defaults(), CancellationSignal.NONE);
    }

    private static byte[] write(long version, Target t) {
        try (ResourceWriter out = new ResourceWriter()) {
            LAYOUT.write(version, out, t, CancellationSignal.NONE);
            return out.toByteArray();
        }
    }

    @Test
    void sectionIntroducedInTenIsAbsentFromNine()
    {
        assertEquals(List.of("base", "tail"), LAYOUT.activeSections(9));
        assertEquals(List.of("base", "extra", "tail"), LAYOUT.activeSections(10));
    }

    @Test
    void readAndWriteHonourTheGate()
    {
        Target t = new Target();
        ParseContext ctx = context("01000000 03000000");
        assertTrue(LAYOUT.read(9, ctx, t));
        assertEquals(1, t.base);
        assertEquals(0, t.extra);
        assertEquals(3, t.tail);
        assertTrue(ctx.diagnostics().isEmpty());

        t.extra = 2;
        assertEquals("0100000003000000", Hex.format(write(9, t)));
        assertEquals("010000000200000003000000", Hex.format(write(10, t)));
    }

    @Test
    void mandatorySectionFailureIsFatal()
    {
        assertThrows(TruncatedDataException.class, () -> LAYOUT.read(10, context("0100"), new Target()));
    }

    @Test
    void sectionsAfterATruncatedOneAreSkipped()
    {
        Target t = new Target();
        ParseContext ctx = context("01000000 0200");

        assertFalse(LAYOUT.read(10, ctx, t));
        assertEquals(1, t.base);
        assertEquals(0, t.extra);
        assertEquals(0, t.tail);

        List<ParseDiagnostic> d = ctx.diagnostics();
        assertEquals(2, d.size());
        assertEquals("extra", d.get(0).section());
        assertEquals(DegradationReason.TRUNCATED, d.get(0).reason());
        assertEquals(4, d.get(0).offset());
        assertTrue(d.get(0).degrading());
        assertEquals("tail", d.get(1).section());
        assertFalse(d.get(1).degrading());
    }

    @Test
    void sectionAfterARejectedCountIsStillRead()
    {
        Target t = new Target();
        ParseContext ctx = context("01000000 05000000 03000000");

        assertFalse(COUNTED.read(0, ctx, t));
        assertEquals(1, t.base);
        assertEquals(0, t.extra);
        assertEquals(3, t.tail);

        List<ParseDiagnostic> d = ctx.diagnostics();
        assertEquals(1, d.size());
        assertEquals("count", d.get(0).section());
        assertEquals(DegradationReason.CAPACITY_EXCEEDED, d.get(0).reason());
        assertTrue(ctx.isAligned());
    }

    @Test
    void cancelledSignalStopsBeforeNextSection()
    {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();
        ParseContext ctx = new ParseContext(ResourceReader.of(new byte[12]), ParseLimits.defaults(), signal);
        Target t = new Target();

        assertThrows(CancellationException.class, () -> LAYOUT.read(10, ctx, t));
        assertEquals(0, t.base);
    }
}
