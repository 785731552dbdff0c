package com.questrail.assetcodec.registry;

/**
 * Opaque token returned by {@link CodecRegistry#register}; identifies one
 * registration.
 *
 * <p>Handles compare by identity. Registering the same descriptor twice
 * yields two distinct handles.</p>
 */
public final class CodecHandle
{
    private final long sequence;
    private final CodecDescriptor<?> descriptor;

    CodecHandle(long sequence, CodecDescriptor<?> descriptor) {
        this.sequence = sequence;
        this.descriptor = descriptor;
    }

    /**
     * Monotonic registration number within the owning registry. A larger
     * value means a later registration.
     */
    public long sequence() {
        return sequence;
    }

    public CodecDescriptor<?> descriptor() {
        return descriptor;
    }

    @Override
    public String toString() {
        return "CodecHandle[#" + sequence + " " + descriptor.name() + "]";
    }
}
