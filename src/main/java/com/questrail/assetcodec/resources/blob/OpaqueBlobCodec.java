package com.questrail.assetcodec.resources.blob;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.codec.CapacityViolationException;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.io.ResourceWriter;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.core.AbstractResourceCodec;

import java.util.Objects;

/**
 * Byte-preserving codec.
 *
 * <p>The registry has no built-in fallback: an unclaimed type id resolves to
 * nothing. A caller that wants unknown payloads kept verbatim registers one of
 * these for the ids it cares about, usually at a priority below the real
 * codec so that the real codec wins whenever it is present.</p>
 *
 * <p>A payload longer than {@link ParseLimits#maxBlobLength()} fails to parse.</p>
 */
public final class OpaqueBlobCodec extends AbstractResourceCodec<OpaqueBlobResource>
{
    private final ResourceTypeId typeId;

    public OpaqueBlobCodec(ResourceTypeId typeId, ParseLimits limits)
    {
        super(OpaqueBlobResource.class, limits);
        this.typeId = Objects.requireNonNull(typeId, "typeId");
    }

    public ResourceTypeId typeId()
    {
        return typeId;
    }

    @Override
    public OpaqueBlobResource create()
    {
        return new OpaqueBlobResource(typeId);
    }

    @Override
    public long supportedVersion()
    {
        return 0;
    }

    @Override
    protected void read(ParseContext ctx, OpaqueBlobResource target)
    {
        final ResourceReader in = ctx.reader();
        if (in.remaining() > ctx.limits().maxBlobLength()) {
            throw new CapacityViolationException("blob", 0, in.remaining(), ctx.limits().maxBlobLength());
        }
        target.load(in.readRemaining());
    }

    @Override
    protected void write(ResourceWriter out, OpaqueBlobResource source, CancellationSignal signal)
    {
        out.writeBytes(source.data());
    }
}
