package com.questrail.assetcodec.codec.io;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ResourceWriter
 * =============================================================================
 * Little-endian sink that accumulates one serialized resource payload.
 *
 * <p>Backed by an unpooled heap {@link ByteBuf} that grows on demand. The buffer
 * is released by {@link #close()}; {@link #toByteArray()} copies the written
 * bytes out first. Netty types never escape this package.</p>
 *
 * <pre>{@code
 * try (ResourceWriter out = new ResourceWriter()) {
 *     out.writeU32(version);
 *     ...
 *     return out.toByteArray();
 * }
 * }</pre>
 */
public final class ResourceWriter implements AutoCloseable
{
    private static final int INITIAL_CAPACITY = 256;

    private final ByteBuf buf;

    public ResourceWriter() {
        this(INITIAL_CAPACITY);
    }

    public ResourceWriter(int initialCapacity) {
        this.buf = Unpooled.buffer(Math.max(16, initialCapacity));
    }

    public int size() {
        return buf.writerIndex();
    }

    public ResourceWriter writeU8(int value) {
        buf.writeByte(value);
        return this;
    }

    public ResourceWriter writeBool(boolean value) {
        buf.writeByte(value ? 1 : 0);
        return this;
    }

    public ResourceWriter writeI32(int value) {
        buf.writeIntLE(value);
        return this;
    }

    /**
     * Writes the low 32 bits of {@code value}.
     */
    public ResourceWriter writeU32(long value) {
        buf.writeIntLE((int) value);
        return this;
    }

    public ResourceWriter writeU64(long value) {
        buf.writeLongLE(value);
        return this;
    }

    public ResourceWriter writeF32(float value) {
        buf.writeFloatLE(value);
        return this;
    }

    public ResourceWriter writeF64(double value) {
        buf.writeDoubleLE(value);
        return this;
    }

    public ResourceWriter writeBytes(byte[] bytes) {
        buf.writeBytes(Objects.requireNonNull(bytes, "bytes"));
        return this;
    }

    public ResourceWriter writeU32String(String value) {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        writeU32(utf8.length);
        buf.writeBytes(utf8);
        return this;
    }

    public ResourceWriter writeI32String(String value) {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        writeI32(utf8.length);
        buf.writeBytes(utf8);
        return this;
    }

    public ResourceWriter write7BitString(String value) {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        int length = utf8.length;
        while (length >= 0x80) {
            buf.writeByte((length & 0x7F) | 0x80);
            length >>>= 7;
        }
        buf.writeByte(length);
        buf.writeBytes(utf8);
        return this;
    }

    /**
     * Writes {@code value} as UTF-16LE code units without a length prefix.
     */
    public ResourceWriter writeUtf16(String value) {
        buf.writeBytes(value.getBytes(StandardCharsets.UTF_16LE));
        return this;
    }

    public byte[] toByteArray() {
        byte[] out = new byte[buf.readableBytes()];
        buf.getBytes(buf.readerIndex(), out);
        return out;
    }

    @Override
    public void close() {
        if (buf.refCnt() > 0) {
            buf.release();
        }
    }
}
