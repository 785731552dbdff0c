package com.questrail.assetcodec.resources.objkey;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.codec.CapacityViolationException;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.io.ResourceWriter;
import com.questrail.assetcodec.codec.layout.SectionResult;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.core.AbstractResourceCodec;

/**
 * Codec for {@link ObjKeyResource}.
 *
 * <p>Layout (little-endian), 20-byte header followed by the data:</p>
 * <pre>
 *   u32 version
 *   u64 objectKey
 *   u32 objectType
 *   i32 dataLength
 *   dataLength bytes
 * </pre>
 */
public final class ObjKeyCodec extends AbstractResourceCodec<ObjKeyResource>
{
    public static final int HEADER_SIZE = 20;

    public ObjKeyCodec(ParseLimits limits)
    {
        super(ObjKeyResource.class, limits);
    }

    @Override
    public ObjKeyResource create()
    {
        return new ObjKeyResource();
    }

    @Override
    public long supportedVersion()
    {
        return ObjKeyResource.SUPPORTED_VERSION;
    }

    @Override
    protected void read(ParseContext ctx, ObjKeyResource target)
    {
        final ResourceReader in = ctx.reader();
        in.require(HEADER_SIZE, "object key header");

        final long version = in.readU32();
        if (version > ObjKeyResource.SUPPORTED_VERSION) {
            throw ResourceFormatException.unsupportedVersion("object key", version, ObjKeyResource.SUPPORTED_VERSION);
        }
        final long key = in.readU64();
        final int type = in.readI32();
        final int dataLength = in.readI32();

        final SectionResult<byte[]> data = ctx.readSection("additionalData", r -> {
            if (dataLength > ctx.limits().maxBlobLength()) {
                throw new CapacityViolationException("additional data", r.position(),
                        dataLength, ctx.limits().maxBlobLength());
            }
            return r.readBytes(dataLength);
        });
        if (data.isOk()) {
            ctx.expectEnd("additionalData");
        }

        target.load(version, key, type, data.orElse(new byte[0]));
    }

    @Override
    protected void write(ResourceWriter out, ObjKeyResource source, CancellationSignal signal)
    {
        final byte[] data = source.additionalData();
        out.writeU32(source.version())
           .writeU64(source.objectKey())
           .writeI32(source.objectType())
           .writeI32(data.length)
           .writeBytes(data);
    }
}
