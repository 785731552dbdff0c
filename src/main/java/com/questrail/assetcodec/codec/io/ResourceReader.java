package com.questrail.assetcodec.codec.io;

import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.codec.CapacityViolationException;
import com.questrail.assetcodec.codec.ResourceFormatException;
import com.questrail.assetcodec.codec.TruncatedDataException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ResourceReader
 * =============================================================================
 * Bounds-checked little-endian cursor over one resource payload.
 *
 * <h2>Netty containment rule</h2>
 * The payload is wrapped in a Netty {@link ByteBuf} for its little-endian
 * accessors. {@code ByteBuf} never escapes this package: callers hand in a
 * {@code byte[]} and receive Java primitives, strings and copied arrays.
 *
 * <h2>Bounds checking</h2>
 * Every read verifies that the bytes it needs are present before touching the
 * buffer and raises {@link TruncatedDataException} otherwise. Length-prefixed
 * reads additionally check the declared length against a caller-supplied
 * ceiling ({@link CapacityViolationException}) before allocating anything, so
 * a hostile length field can never cause a large allocation.
 *
 * <h2>Resuming</h2>
 * A rejected count leaves the reader just past the count field, and an
 * over-long or malformed string whose bytes are all present is skipped before
 * the failure is raised. Those failures are
 * {@linkplain com.questrail.assetcodec.codec.ResourceParseException#resumable() resumable}.
 * Text is decoded strictly, so every string a reader returns re-encodes to
 * exactly the bytes it came from.
 *
 * <p>The wrapped array is never copied and never modified. A reader is not
 * thread-safe.</p>
 */
public final class ResourceReader
{
    private final ByteBuf buf;

    private ResourceReader(ByteBuf buf) {
        this.buf = buf;
    }

    public static ResourceReader of(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new ResourceReader(Unpooled.wrappedBuffer(payload));
    }

    public int position() {
        return buf.readerIndex();
    }

    public int remaining() {
        return buf.readableBytes();
    }

    public boolean hasRemaining() {
        return buf.isReadable();
    }

    /**
     * Ensures at least {@code count} more bytes are available.
     *
     * @throws TruncatedDataException if fewer bytes remain
     */
    public void require(long count, String what) {
        if (count > buf.readableBytes()) {
            throw new TruncatedDataException(what, buf.readerIndex(), count, buf.readableBytes());
        }
    }

    /**
     * Validates a declared record count before any storage is allocated for it.
     *
     * @param declared      the count read from the payload
     * @param minRecordSize the smallest number of bytes one record can occupy
     * @param maxCount      the configured ceiling
     * @return {@code declared} as an {@code int}
     * @throws CapacityViolationException if {@code declared} exceeds {@code maxCount}; the
     *                                    reader is left just past the count field
     * @throws TruncatedDataException     if the records cannot fit in the remaining bytes
     */
    public int checkCount(String what, long declared, int minRecordSize, int maxCount) {
        if (declared < 0) {
            throw new ResourceFormatException(what + " declares negative count " + declared,
                    buf.readerIndex(), DegradationReason.INVALID_LENGTH);
        }
        if (declared > maxCount) {
            throw new CapacityViolationException(what, buf.readerIndex(), declared, maxCount, true);
        }
        require(declared * minRecordSize, what);
        return (int) declared;
    }

    public int readU8() {
        require(1, "u8");
        return buf.readUnsignedByte();
    }

    /**
     * Reads a one-byte boolean. Only {@code 0} and {@code 1} are accepted so that
     * the value re-serializes to the same byte.
     */
    public boolean readBool() {
        require(1, "bool");
        int at = buf.readerIndex();
        int b = buf.readUnsignedByte();
        if (b > 1) {
            throw new ResourceFormatException("Invalid boolean byte " + b, at);
        }
        return b == 1;
    }

    public int readI32() {
        require(4, "i32");
        return buf.readIntLE();
    }

    /**
     * Reads an unsigned 32-bit value widened to {@code long}.
     */
    public long readU32() {
        require(4, "u32");
        return buf.readUnsignedIntLE();
    }

    /**
     * Reads a 64-bit value. Unsigned payload fields are returned with the same
     * bit pattern; use {@link Long#toUnsignedString(long)} to display them.
     */
    public long readU64() {
        require(8, "u64");
        return buf.readLongLE();
    }

    public float readF32() {
        require(4, "f32");
        return buf.readFloatLE();
    }

    public double readF64() {
        require(8, "f64");
        return buf.readDoubleLE();
    }

    public byte[] readBytes(int count) {
        if (count < 0) {
            throw new ResourceFormatException("Negative byte count " + count,
                    buf.readerIndex(), DegradationReason.INVALID_LENGTH);
        }
        require(count, "bytes");
        byte[] out = new byte[count];
        buf.readBytes(out);
        return out;
    }

    /**
     * Reads every byte left in the payload.
     */
    public byte[] readRemaining() {
        return readBytes(buf.readableBytes());
    }

    /**
     * Reads a string prefixed by an unsigned 32-bit byte length.
     */
    public String readU32String(int maxBytes) {
        int at = buf.readerIndex();
        long length = readU32();
        return readUtf8(at, length, maxBytes);
    }

    /**
     * Reads a string prefixed by a signed 32-bit byte length. A negative length
     * is an {@link DegradationReason#INVALID_LENGTH} format error.
     */
    public String readI32String(int maxBytes) {
        int at = buf.readerIndex();
        int length = readI32();
        if (length < 0) {
            throw new ResourceFormatException("Negative string length " + length, at,
                    DegradationReason.INVALID_LENGTH);
        }
        return readUtf8(at, length, maxBytes);
    }

    /**
     * Reads a string prefixed by a 7-bit variable-length encoded byte length
     * (low groups first, high bit set on every byte but the last).
     */
    public String read7BitString(int maxBytes) {
        int at = buf.readerIndex();
        return readUtf8(at, read7BitLength(), maxBytes);
    }

    /**
     * Reads {@code charCount} UTF-16LE code units.
     */
    public String readUtf16(int charCount, int maxChars) {
        int at = buf.readerIndex();
        if (charCount < 0) {
            throw new ResourceFormatException("Negative character count " + charCount, at,
                    DegradationReason.INVALID_LENGTH);
        }
        if (charCount > maxChars) {
            throw overLong("UTF-16 string", at, 2L * charCount, charCount, maxChars);
        }
        require(2L * charCount, "UTF-16 string");
        return decode(StandardCharsets.UTF_16LE, 2 * charCount);
    }

    private int read7BitLength() {
        int at = buf.readerIndex();
        int value = 0;
        for (int shift = 0; shift < 35; shift += 7) {
            int b = readU8();
            value |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                if (value < 0) {
                    break;
                }
                return value;
            }
        }
        throw new ResourceFormatException("Malformed 7-bit encoded length", at,
                DegradationReason.INVALID_LENGTH);
    }

    private String readUtf8(int lengthOffset, long length, int maxBytes) {
        if (length > maxBytes) {
            throw overLong("String", lengthOffset, length, length, maxBytes);
        }
        require(length, "string");
        return decode(StandardCharsets.UTF_8, (int) length);
    }

    private CapacityViolationException overLong(String what, int at, long byteLength, long declared, int limit) {
        if (byteLength <= buf.readableBytes()) {
            buf.skipBytes((int) byteLength);
            return new CapacityViolationException(what, at, declared, limit, true);
        }
        return new CapacityViolationException(what, at, declared, limit);
    }

    private String decode(Charset charset, int length) {
        int at = buf.readerIndex();
        ByteBuffer bytes = buf.nioBuffer(at, length);
        buf.skipBytes(length);
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(bytes)
                    .toString();
        } catch (CharacterCodingException e) {
            throw ResourceFormatException.malformedText(charset.name(), at, e);
        }
    }
}
