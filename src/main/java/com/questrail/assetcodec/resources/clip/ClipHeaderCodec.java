package com.questrail.assetcodec.resources.clip;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.codec.CapacityViolationException;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.io.ResourceWriter;
import com.questrail.assetcodec.codec.layout.VersionedLayout;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.core.AbstractResourceCodec;

import java.util.ArrayList;
import java.util.List;

/**
 * Codec for {@link ClipHeaderResource}.
 *
 * <p>Layout (little-endian), after a leading {@code u32 version}:</p>
 * <pre>
 *   header                     u32 flags, f32 duration, 4 x f32 rotation, 3 x f32 translation
 *   referenceNamespaceHash     u32                  (version &gt;= 5)
 *   surfaceHashes              u32 namespace, u32 jointName (version &gt;= 10)
 *   surfaceChildNamespaceHash  u32                  (version &gt;= 11)
 *   clipName                   str                  (version &gt;= 7)
 *   rigName                    str
 *   explicitNamespaces         u32 count, count x str (version &gt;= 4)
 *   slotAssignments            u32 count, count x { str, u32, str, u32 }
 *   events                     u32 count, count x { str, f32, f32, u32, str }
 *   primaryClipData            u32 count, count x { str, u32 numTicks, f32, 12 x numTicks bytes }
 *   secondaryClipData          same as primaryClipData
 *   trailer                    every remaining byte
 * </pre>
 * {@code str} is a u32 byte length followed by UTF-8.
 *
 * <p>The header and hash fields are mandatory; a payload too short for them
 * fails to parse. Everything from {@code clipName} on is optional.</p>
 */
public final class ClipHeaderCodec extends AbstractResourceCodec<ClipHeaderResource>
{
    private static final int MIN_NAMESPACE_SIZE = 4;
    private static final int MIN_SLOT_SIZE = 16;
    private static final int MIN_EVENT_SIZE = 20;
    private static final int MIN_CHANNEL_SIZE = 12;

    static final VersionedLayout<ClipHeaderResource> LAYOUT = VersionedLayout.<ClipHeaderResource>builder()
            .mandatory("header", 0, ClipHeaderCodec::readHeader, ClipHeaderCodec::writeHeader)
            .mandatory("referenceNamespaceHash", 5,
                    (ctx, t) -> t.loadReferenceNamespaceHash(ctx.reader().readI32()),
                    (out, s, signal) -> out.writeI32(s.referenceNamespaceHash()))
            .mandatory("surfaceHashes", 10,
                    ClipHeaderCodec::readSurfaceHashes,
                    (out, s, signal) -> out.writeI32(s.surfaceNamespaceHash()).writeI32(s.surfaceJointNameHash()))
            .mandatory("surfaceChildNamespaceHash", 11,
                    (ctx, t) -> t.loadSurfaceChildNamespaceHash(ctx.reader().readI32()),
                    (out, s, signal) -> out.writeI32(s.surfaceChildNamespaceHash()))
            .optional("clipName", 7,
                    (ctx, t) -> t.loadClipName(readString(ctx)),
                    (out, s, signal) -> out.writeU32String(s.clipName()))
            .optional("rigName", 0,
                    (ctx, t) -> t.loadRigName(readString(ctx)),
                    (out, s, signal) -> out.writeU32String(s.rigName()))
            .optional("explicitNamespaces", 4,
                    ClipHeaderCodec::readNamespaces, ClipHeaderCodec::writeNamespaces)
            .optional("slotAssignments", 0,
                    ClipHeaderCodec::readSlots, ClipHeaderCodec::writeSlots)
            .optional("events", 0,
                    ClipHeaderCodec::readEvents, ClipHeaderCodec::writeEvents)
            .optional("primaryClipData", 0,
                    (ctx, t) -> t.loadPrimaryClipData(readChannels(ctx, "primary clip data")),
                    (out, s, signal) -> writeChannels(out, s.primaryClipData(), signal))
            .optional("secondaryClipData", 0,
                    (ctx, t) -> t.loadSecondaryClipData(readChannels(ctx, "secondary clip data")),
                    (out, s, signal) -> writeChannels(out, s.secondaryClipData(), signal))
            .optional("trailer", 0, ClipHeaderCodec::readTrailer,
                    (out, s, signal) -> out.writeBytes(s.trailingData()))
            .build();

    public ClipHeaderCodec(ParseLimits limits)
    {
        super(ClipHeaderResource.class, limits);
    }

    @Override
    public ClipHeaderResource create()
    {
        return new ClipHeaderResource();
    }

    @Override
    public long supportedVersion()
    {
        return ClipHeaderResource.SUPPORTED_VERSION;
    }

    @Override
    protected void read(ParseContext ctx, ClipHeaderResource target)
    {
        final long version = ctx.reader().readU32();
        if (version > ClipHeaderResource.SUPPORTED_VERSION) {
            throw ResourceFormatException.unsupportedVersion("clip header", version,
                    ClipHeaderResource.SUPPORTED_VERSION);
        }
        target.loadVersion(version);
        LAYOUT.read(version, ctx, target);
    }

    @Override
    protected void write(ResourceWriter out, ClipHeaderResource source, CancellationSignal signal)
    {
        final long version = source.version();
        out.writeU32(version);
        LAYOUT.write(version, out, source, signal);
    }

    // ---------------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------------

    private static void readHeader(ParseContext ctx, ClipHeaderResource target)
    {
        final ResourceReader in = ctx.reader();
        final int flags = in.readI32();
        final float duration = in.readF32();
        final Rotation rotation = new Rotation(in.readF32(), in.readF32(), in.readF32(), in.readF32());
        final Translation translation = new Translation(in.readF32(), in.readF32(), in.readF32());
        target.loadHeader(flags, duration, rotation, translation);
    }

    private static void writeHeader(ResourceWriter out, ClipHeaderResource source, CancellationSignal signal)
    {
        final Rotation r = source.rotation();
        final Translation t = source.translation();
        out.writeI32(source.flags())
           .writeF32(source.duration())
           .writeF32(r.x()).writeF32(r.y()).writeF32(r.z()).writeF32(r.w())
           .writeF32(t.x()).writeF32(t.y()).writeF32(t.z());
    }

    private static void readSurfaceHashes(ParseContext ctx, ClipHeaderResource target)
    {
        final int namespaceHash = ctx.reader().readI32();
        final int jointNameHash = ctx.reader().readI32();
        target.loadSurfaceHashes(namespaceHash, jointNameHash);
    }

    private static void readNamespaces(ParseContext ctx, ClipHeaderResource target)
    {
        final ResourceReader in = ctx.reader();
        final int count = in.checkCount("explicit namespaces", in.readU32(), MIN_NAMESPACE_SIZE,
                ctx.limits().maxSectionCount());
        final List<String> namespaces = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ctx.checkpoint();
            namespaces.add(readString(ctx));
        }
        target.loadExplicitNamespaces(namespaces);
    }

    private static void writeNamespaces(ResourceWriter out, ClipHeaderResource source, CancellationSignal signal)
    {
        final List<String> namespaces = source.explicitNamespaces();
        out.writeU32(namespaces.size());
        for (String ns : namespaces) {
            signal.throwIfCancelled();
            out.writeU32String(ns);
        }
    }

    private static void readSlots(ParseContext ctx, ClipHeaderResource target)
    {
        final ResourceReader in = ctx.reader();
        final int count = in.checkCount("slot assignments", in.readU32(), MIN_SLOT_SIZE,
                ctx.limits().maxSectionCount());
        final List<SlotAssignment> slots = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ctx.checkpoint();
            final String containerSlotName = readString(ctx);
            final int containerSlotType = in.readI32();
            final String actorSlotName = readString(ctx);
            final int actorSlotType = in.readI32();
            slots.add(new SlotAssignment(containerSlotName, containerSlotType, actorSlotName, actorSlotType));
        }
        target.loadSlotAssignments(slots);
    }

    private static void writeSlots(ResourceWriter out, ClipHeaderResource source, CancellationSignal signal)
    {
        final List<SlotAssignment> slots = source.slotAssignments();
        out.writeU32(slots.size());
        for (SlotAssignment s : slots) {
            signal.throwIfCancelled();
            out.writeU32String(s.containerSlotName())
               .writeI32(s.containerSlotType())
               .writeU32String(s.actorSlotName())
               .writeI32(s.actorSlotType());
        }
    }

    private static void readEvents(ParseContext ctx, ClipHeaderResource target)
    {
        final ResourceReader in = ctx.reader();
        final int count = in.checkCount("events", in.readU32(), MIN_EVENT_SIZE, ctx.limits().maxSectionCount());
        final List<ClipEvent> events = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ctx.checkpoint();
            final String name = readString(ctx);
            final float startTime = in.readF32();
            final float duration = in.readF32();
            final int eventType = in.readI32();
            final String eventData = readString(ctx);
            events.add(new ClipEvent(name, startTime, duration, eventType, eventData));
        }
        target.loadEvents(events);
    }

    private static void writeEvents(ResourceWriter out, ClipHeaderResource source, CancellationSignal signal)
    {
        final List<ClipEvent> events = source.events();
        out.writeU32(events.size());
        for (ClipEvent e : events) {
            signal.throwIfCancelled();
            out.writeU32String(e.name())
               .writeF32(e.startTime())
               .writeF32(e.duration())
               .writeI32(e.eventType())
               .writeU32String(e.eventData());
        }
    }

    private static List<ClipChannel> readChannels(ParseContext ctx, String what)
    {
        final ResourceReader in = ctx.reader();
        final int count = in.checkCount(what, in.readU32(), MIN_CHANNEL_SIZE, ctx.limits().maxSectionCount());
        final List<ClipChannel> channels = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ctx.checkpoint();
            final String channelName = readString(ctx);
            final int at = in.position();
            final long tickBytes = in.readU32() * ClipChannel.TICK_SIZE;
            final float ticksPerFrame = in.readF32();
            if (tickBytes > ctx.limits().maxBlobLength()) {
                throw new CapacityViolationException("tick data", at, tickBytes, ctx.limits().maxBlobLength());
            }
            channels.add(new ClipChannel(channelName, ticksPerFrame, in.readBytes((int) tickBytes)));
        }
        return channels;
    }

    private static void writeChannels(ResourceWriter out, List<ClipChannel> channels, CancellationSignal signal)
    {
        out.writeU32(channels.size());
        for (ClipChannel c : channels) {
            signal.throwIfCancelled();
            out.writeU32String(c.channelName())
               .writeU32(c.numTicks())
               .writeF32(c.ticksPerFrame())
               .writeBytes(c.tickData());
        }
    }

    private static void readTrailer(ParseContext ctx, ClipHeaderResource target)
    {
        final ResourceReader in = ctx.reader();
        if (in.remaining() > ctx.limits().maxBlobLength()) {
            throw new CapacityViolationException("trailing data", in.position(), in.remaining(),
                    ctx.limits().maxBlobLength());
        }
        target.loadTrailingData(in.readRemaining());
    }

    private static String readString(ParseContext ctx)
    {
        return ctx.reader().readU32String(ctx.limits().maxStringLength());
    }
}
