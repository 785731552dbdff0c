package com.questrail.assetcodec.codec;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.ResourceInstance;

/**
 * ResourceCodec
 * -----------------------------------------------------------------------------
 * Parse/serialize pair for one binary resource format.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #parse} never returns a partially built instance to anyone but
 *       its caller: the result is assembled off to the side and handed back
 *       only once reading has finished.</li>
 *   <li>A fatal problem in the mandatory header (bad magic, unsupported
 *       version, too few bytes) raises a {@link ResourceParseException}.</li>
 *   <li>A problem inside an optional section does not raise; it is recorded in
 *       the instance's diagnostics and the section is treated as empty.</li>
 *   <li>A zero-length payload yields the same default instance as
 *       {@link #create()}.</li>
 *   <li>For every payload accepted without degradation,
 *       {@code serialize(parse(b))} equals {@code b} byte for byte.</li>
 * </ul>
 *
 * <p>Implementations are stateless apart from their configuration and may be
 * shared by any number of threads.</p>
 */
public interface ResourceCodec<R extends ResourceInstance>
{
    /**
     * Returns a new default-valued instance.
     */
    R create();

    /**
     * Parses {@code payload} into a new instance.
     *
     * @throws ResourceParseException                   if the mandatory header cannot be read
     * @throws java.util.concurrent.CancellationException if {@code signal} is cancelled
     */
    R parse(byte[] payload, CancellationSignal signal);

    /**
     * Serializes {@code instance} using the layout of its current version and
     * clears its dirty flag.
     *
     * @throws IllegalStateException if the instance has been disposed
     */
    byte[] serialize(R instance, CancellationSignal signal);

    /**
     * Highest format version this codec reads and writes.
     */
    long supportedVersion();

    Class<R> resourceClass();

    default R parse(byte[] payload) {
        return parse(payload, CancellationSignal.NONE);
    }

    default byte[] serialize(R instance) {
        return serialize(instance, CancellationSignal.NONE);
    }

    /**
     * Serializes an instance whose static type has been erased, for callers
     * that resolved this codec through a registry.
     *
     * @throws IllegalArgumentException if the instance was not produced by this codec's format
     */
    default byte[] serializeInstance(ResourceInstance instance, CancellationSignal signal) {
        Class<R> type = resourceClass();
        if (!type.isInstance(instance)) {
            throw new IllegalArgumentException("Codec for " + type.getSimpleName()
                    + " cannot serialize " + (instance == null ? "null" : instance.getClass().getSimpleName()));
        }
        return serialize(type.cast(instance), signal);
    }
}
