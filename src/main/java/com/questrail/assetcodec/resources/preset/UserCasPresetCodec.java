package com.questrail.assetcodec.resources.preset;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.io.ResourceWriter;
import com.questrail.assetcodec.codec.layout.SectionResult;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.core.AbstractResourceCodec;

import java.util.ArrayList;
import java.util.List;

/**
 * Codec for {@link UserCasPresetResource}.
 *
 * <p>Layout (little-endian):</p>
 * <pre>
 *   u32 version, u32 unknown1, u32 unknown2, u32 unknown3
 *   u32 count
 *   count x { i32 xmlChars, UTF-16LE xml, u8, u8, u32, u8, u8, u8 }
 * </pre>
 */
public final class UserCasPresetCodec extends AbstractResourceCodec<UserCasPresetResource>
{
    // xmlChars + the six trailing flag fields
    private static final int MIN_PRESET_SIZE = 4 + 9;

    public UserCasPresetCodec(ParseLimits limits)
    {
        super(UserCasPresetResource.class, limits);
    }

    @Override
    public UserCasPresetResource create()
    {
        return new UserCasPresetResource();
    }

    @Override
    public long supportedVersion()
    {
        return UserCasPresetResource.SUPPORTED_VERSION;
    }

    @Override
    protected void read(ParseContext ctx, UserCasPresetResource target)
    {
        final ResourceReader in = ctx.reader();
        in.require(20, "user CAS preset header");

        final long version = in.readU32();
        if (version > UserCasPresetResource.SUPPORTED_VERSION) {
            throw ResourceFormatException.unsupportedVersion("user CAS preset", version,
                    UserCasPresetResource.SUPPORTED_VERSION);
        }
        final long unknown1 = in.readU32();
        final long unknown2 = in.readU32();
        final long unknown3 = in.readU32();
        final long count = in.readU32();

        final SectionResult<List<CasPreset>> presets = ctx.readSection("presets", r -> readPresets(ctx, r, count));
        if (presets.isOk()) {
            ctx.expectEnd("presets");
        }
        target.load(version, unknown1, unknown2, unknown3, presets.orElse(List.of()));
    }

    private List<CasPreset> readPresets(ParseContext ctx, ResourceReader in, long declared)
    {
        final int count = in.checkCount("CAS presets", declared, MIN_PRESET_SIZE, ctx.limits().maxSectionCount());
        final List<CasPreset> presets = new ArrayList<>(count);
        final int maxChars = ctx.limits().maxBlobLength() / 2;

        for (int i = 0; i < count; i++) {
            ctx.checkpoint();
            final String xml = in.readUtf16(in.readI32(), maxChars);
            presets.add(new CasPreset(xml,
                    in.readU8(),
                    in.readU8(),
                    in.readI32(),
                    in.readU8(),
                    in.readU8(),
                    in.readU8()));
        }
        return presets;
    }

    @Override
    protected void write(ResourceWriter out, UserCasPresetResource source, CancellationSignal signal)
    {
        final List<CasPreset> presets = source.presets();
        out.writeU32(source.version())
           .writeU32(source.unknown1())
           .writeU32(source.unknown2())
           .writeU32(source.unknown3())
           .writeU32(presets.size());

        for (CasPreset p : presets) {
            signal.throwIfCancelled();
            out.writeI32(p.xml().length())
               .writeUtf16(p.xml())
               .writeU8(p.unknown1())
               .writeU8(p.unknown2())
               .writeI32(p.unknown3())
               .writeU8(p.unknown4())
               .writeU8(p.unknown5())
               .writeU8(p.unknown6());
        }
    }
}
