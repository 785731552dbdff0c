package com.questrail.assetcodec.resources.ngmp;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.io.ResourceWriter;
import com.questrail.assetcodec.codec.layout.SectionResult;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.core.AbstractResourceCodec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Codec for {@link NgmpResource}.
 *
 * <p>Layout (little-endian):</p>
 * <pre>
 *   u32 version   (must be 1)
 *   u32 count
 *   count x { u64 nameHash, u64 instance }
 * </pre>
 *
 * <p>Repeated name hashes are kept as-is and noted in the diagnostics without
 * clearing validity.</p>
 */
public final class NgmpCodec extends AbstractResourceCodec<NgmpResource>
{
    private static final int PAIR_SIZE = 16;

    public NgmpCodec(ParseLimits limits)
    {
        super(NgmpResource.class, limits);
    }

    @Override
    public NgmpResource create()
    {
        return new NgmpResource();
    }

    @Override
    public long supportedVersion()
    {
        return NgmpResource.SUPPORTED_VERSION;
    }

    @Override
    protected void read(ParseContext ctx, NgmpResource target)
    {
        final ResourceReader in = ctx.reader();

        final long version = in.readU32();
        if (version != NgmpResource.SUPPORTED_VERSION) {
            throw new ResourceFormatException("Unsupported NGMP version: " + version + ". Expected: 1", 0);
        }
        final long count = in.readU32();

        final SectionResult<List<NamePair>> pairs = ctx.readSection("pairs", r -> readPairs(ctx, r, count));
        if (pairs.isOk()) {
            ctx.expectEnd("pairs");
        }
        target.load(pairs.orElse(List.of()));
    }

    private List<NamePair> readPairs(ParseContext ctx, ResourceReader in, long declared)
    {
        final int count = in.checkCount("NGMP pairs", declared, PAIR_SIZE, ctx.limits().maxSectionCount());
        final List<NamePair> pairs = new ArrayList<>(count);
        final Set<Long> seen = new HashSet<>();

        for (int i = 0; i < count; i++) {
            ctx.checkpoint();
            final int at = in.position();
            final NamePair p = new NamePair(in.readU64(), in.readU64());
            if (!seen.add(p.nameHash())) {
                ctx.note("pairs", DegradationReason.DUPLICATE_KEY, at,
                        "Repeated name hash 0x" + Long.toHexString(p.nameHash()));
            }
            pairs.add(p);
        }
        return pairs;
    }

    @Override
    protected void write(ResourceWriter out, NgmpResource source, CancellationSignal signal)
    {
        final List<NamePair> pairs = source.pairs();
        out.writeU32(source.version());
        out.writeU32(pairs.size());
        for (NamePair p : pairs) {
            signal.throwIfCancelled();
            out.writeU64(p.nameHash()).writeU64(p.instance());
        }
    }
}
