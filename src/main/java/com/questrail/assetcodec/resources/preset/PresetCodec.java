package com.questrail.assetcodec.resources.preset;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.api.ResourceValue;
import com.questrail.assetcodec.codec.CapacityViolationException;
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
 * Codec for {@link PresetResource}.
 *
 * <p>Layout (little-endian):</p>
 * <pre>
 *   i32 major, i32 minor
 *   i32 typeLength,  utf8 type
 *   i32 nameLength,  utf8 name
 *   i32 count
 *   count x { i32 keyLength, utf8 key, u8 kind, value }
 * </pre>
 * Value encodings by kind:
 * <ul>
 *   <li>1: 7-bit length-prefixed UTF-8 string</li>
 *   <li>2: i32</li>
 *   <li>3: f64</li>
 *   <li>4: bool (one byte)</li>
 *   <li>5: i32 length followed by raw bytes</li>
 * </ul>
 */
public final class PresetCodec extends AbstractResourceCodec<PresetResource>
{
    static final int KIND_STRING = 1;
    static final int KIND_INT32 = 2;
    static final int KIND_FLOAT64 = 3;
    static final int KIND_BOOL = 4;
    static final int KIND_BYTES = 5;

    // keyLength + kind + smallest value
    private static final int MIN_ENTRY_SIZE = 6;

    public PresetCodec(ParseLimits limits)
    {
        super(PresetResource.class, limits);
    }

    @Override
    public PresetResource create()
    {
        return new PresetResource();
    }

    /**
     * Presets carry their own {@code major.minor} content version; the binary
     * layout itself has a single revision.
     */
    @Override
    public long supportedVersion()
    {
        return 1;
    }

    @Override
    protected void read(ParseContext ctx, PresetResource target)
    {
        final ResourceReader in = ctx.reader();
        final int major = in.readI32();
        final int minor = in.readI32();
        if (major < 0 || minor < 0) {
            throw new ResourceFormatException("Invalid preset version " + major + "." + minor, 0);
        }

        final int maxName = ctx.limits().maxStringLength();
        final SectionResult<String> type = ctx.readSection("presetType", r -> r.readI32String(maxName));
        final SectionResult<String> name = ctx.readSection("presetName", r -> r.readI32String(maxName));
        final SectionResult<LinkedHashMap<String, ResourceValue>> data =
                ctx.readSection("data", r -> readData(ctx, r));
        if (ctx.isAligned() && data.isOk()) {
            ctx.expectEnd("data");
        }

        target.load(major, minor,
                type.orElse(PresetResource.DEFAULT_TYPE),
                name.orElse(PresetResource.DEFAULT_NAME),
                data.orElse(new LinkedHashMap<>()));
    }

    private LinkedHashMap<String, ResourceValue> readData(ParseContext ctx, ResourceReader in)
    {
        final int count = in.checkCount("preset data", in.readI32(), MIN_ENTRY_SIZE, ctx.limits().maxSectionCount());
        final LinkedHashMap<String, ResourceValue> data = new LinkedHashMap<>(count * 2);

        for (int i = 0; i < count; i++) {
            ctx.checkpoint();
            final int at = in.position();
            final String key = in.readI32String(ctx.limits().maxStringLength());
            final ResourceValue value = readValue(ctx, in);
            if (data.put(key, value) != null) {
                ctx.degrade("data", DegradationReason.DUPLICATE_KEY, at, "Duplicate key '" + key + "'");
            }
        }
        return data;
    }

    private ResourceValue readValue(ParseContext ctx, ResourceReader in)
    {
        final int at = in.position();
        final int kind = in.readU8();
        return switch (kind) {
            case KIND_STRING -> ResourceValue.text(in.read7BitString(ctx.limits().maxBlobLength()));
            case KIND_INT32 -> ResourceValue.of(in.readI32());
            case KIND_FLOAT64 -> ResourceValue.of(in.readF64());
            case KIND_BOOL -> ResourceValue.of(in.readBool());
            case KIND_BYTES -> {
                final int length = in.readI32();
                if (length > ctx.limits().maxBlobLength()) {
                    throw new CapacityViolationException(
                            "preset bytes", at, length, ctx.limits().maxBlobLength());
                }
                yield ResourceValue.of(in.readBytes(length));
            }
            default -> throw new ResourceFormatException("Unknown value type: " + kind, at,
                    DegradationReason.UNKNOWN_KIND);
        };
    }

    @Override
    protected void write(ResourceWriter out, PresetResource source, CancellationSignal signal)
    {
        out.writeI32(source.majorVersion())
           .writeI32(source.minorVersion())
           .writeI32String(source.presetType())
           .writeI32String(source.presetName());

        final Map<String, ResourceValue> data = source.data();
        out.writeI32(data.size());
        for (Map.Entry<String, ResourceValue> e : data.entrySet()) {
            signal.throwIfCancelled();
            out.writeI32String(e.getKey());
            writeValue(out, e.getValue());
        }
    }

    private static void writeValue(ResourceWriter out, ResourceValue value)
    {
        if (value instanceof ResourceValue.TextValue t) {
            out.writeU8(KIND_STRING).write7BitString(t.value());
        }
        else if (value instanceof ResourceValue.IntegerValue i) {
            out.writeU8(KIND_INT32).writeI32(Math.toIntExact(i.value()));
        }
        else if (value instanceof ResourceValue.FloatValue f) {
            out.writeU8(KIND_FLOAT64).writeF64(f.value());
        }
        else if (value instanceof ResourceValue.BoolValue b) {
            out.writeU8(KIND_BOOL).writeBool(b.value());
        }
        else if (value instanceof ResourceValue.BytesValue b) {
            byte[] bytes = b.value();
            out.writeU8(KIND_BYTES).writeI32(bytes.length).writeBytes(bytes);
        }
        else {
            throw new IllegalStateException("Unhandled value kind " + value.kind());
        }
    }
}
