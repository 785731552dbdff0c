package com.questrail.assetcodec.core;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.ResourceCodec;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.io.ResourceWriter;
import com.questrail.assetcodec.config.ParseLimits;

import java.util.List;
import java.util.Objects;

/**
 * AbstractResourceCodec
 * -----------------------------------------------------------------------------
 * Shared driver for the built-in codecs.
 *
 * <p>This class owns the steps every format repeats:</p>
 * <ol>
 *   <li>Argument and cancellation checks on entry</li>
 *   <li>The zero-length payload rule</li>
 *   <li>Creating the reader, {@link ParseContext} and writer</li>
 *   <li>Publishing diagnostics and lifecycle state once reading or writing has finished</li>
 * </ol>
 *
 * <p>Subclasses supply only the byte layout through {@link #read} and
 * {@link #write}. The lifecycle transitions of {@link AbstractResourceInstance}
 * are package-private, so only this driver moves an instance to
 * {@code POPULATED} or {@code SERIALIZED}.</p>
 */
public abstract class AbstractResourceCodec<R extends AbstractResourceInstance> implements ResourceCodec<R>
{
    private final Class<R> resourceClass;
    protected final ParseLimits limits;

    protected AbstractResourceCodec(Class<R> resourceClass, ParseLimits limits)
    {
        this.resourceClass = Objects.requireNonNull(resourceClass, "resourceClass");
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    @Override
    public final Class<R> resourceClass()
    {
        return resourceClass;
    }

    public ParseLimits limits()
    {
        return limits;
    }

    @Override
    public final R parse(byte[] payload, CancellationSignal signal)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(signal, "signal");
        signal.throwIfCancelled();

        final R target = create();
        if (payload.length == 0) {
            target.markPopulated(List.of());
            return target;
        }

        final ParseContext ctx = new ParseContext(ResourceReader.of(payload), limits, signal);
        read(ctx, target);
        signal.throwIfCancelled();

        target.markPopulated(ctx.diagnostics());
        return target;
    }

    @Override
    public final byte[] serialize(R instance, CancellationSignal signal)
    {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(signal, "signal");
        signal.throwIfCancelled();

        final byte[] bytes;
        try (ResourceWriter out = new ResourceWriter()) {
            write(out, instance, signal);
            bytes = out.toByteArray();
        }
        instance.markSerialized();
        return bytes;
    }

    /**
     * Reads the payload behind {@code ctx} into {@code target}, a fresh
     * instance nobody else can observe yet.
     */
    protected abstract void read(ParseContext ctx, R target);

    protected abstract void write(ResourceWriter out, R source, CancellationSignal signal);
}
