package com.questrail.assetcodec.resources.hashmap;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.api.ResourceValue;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.io.ResourceWriter;
import com.questrail.assetcodec.codec.layout.SectionResult;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.core.AbstractResourceCodec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Codec for {@link HashMapResource}.
 *
 * <p>Layout (little-endian):</p>
 * <pre>
 *   u32 version
 *   u32 count
 *   count x { u32 key, i32 byteLength, utf8 value }
 * </pre>
 *
 * <p>A key that appears twice keeps its first position and its last value;
 * the duplicate degrades the instance because it cannot round-trip.</p>
 */
public final class HashMapCodec extends AbstractResourceCodec<HashMapResource>
{
    private static final int MIN_ENTRY_SIZE = 8;

    public HashMapCodec(ParseLimits limits)
    {
        super(HashMapResource.class, limits);
    }

    @Override
    public HashMapResource create()
    {
        return new HashMapResource();
    }

    @Override
    public long supportedVersion()
    {
        return HashMapResource.SUPPORTED_VERSION;
    }

    @Override
    protected void read(ParseContext ctx, HashMapResource target)
    {
        final ResourceReader in = ctx.reader();

        final long version = in.readU32();
        if (version > HashMapResource.SUPPORTED_VERSION) {
            throw ResourceFormatException.unsupportedVersion("hash map", version, HashMapResource.SUPPORTED_VERSION);
        }
        final long count = in.readU32();

        final SectionResult<LinkedHashMap<Integer, ResourceValue>> entries =
                ctx.readSection("entries", r -> readEntries(ctx, r, count));
        if (entries.isOk()) {
            ctx.expectEnd("entries");
        }

        target.load(version, entries.orElse(new LinkedHashMap<>()));
    }

    private LinkedHashMap<Integer, ResourceValue> readEntries(ParseContext ctx, ResourceReader in, long declared)
    {
        final int count = in.checkCount("hash map entries", declared, MIN_ENTRY_SIZE, ctx.limits().maxSectionCount());
        final LinkedHashMap<Integer, ResourceValue> entries = new LinkedHashMap<>(count * 2);

        for (int i = 0; i < count; i++) {
            ctx.checkpoint();
            final int at = in.position();
            final int key = in.readI32();
            final String text = in.readI32String(ctx.limits().maxBlobLength());
            if (entries.put(key, ResourceValue.text(text)) != null) {
                ctx.degrade("entries", DegradationReason.DUPLICATE_KEY, at,
                        "Duplicate key " + Integer.toUnsignedString(key));
            }
        }
        return entries;
    }

    @Override
    protected void write(ResourceWriter out, HashMapResource source, CancellationSignal signal)
    {
        final Map<Integer, ResourceValue> entries = source.entries();

        out.writeU32(source.version());
        out.writeU32(entries.size());
        for (Map.Entry<Integer, ResourceValue> e : entries.entrySet()) {
            signal.throwIfCancelled();
            out.writeI32(e.getKey());
            out.writeI32String(e.getValue().toWireText());
        }
    }
}
