package com.questrail.assetcodec.runtime;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.ResourceInstance;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.codec.ResourceCodec;
import com.questrail.assetcodec.config.CodecRuntimeConfig;
import com.questrail.assetcodec.observability.CodecErrorEvent;
import com.questrail.assetcodec.observability.CodecObservabilitySink;
import com.questrail.assetcodec.observability.DegradedParseEvent;
import com.questrail.assetcodec.observability.NullObservabilitySink;
import com.questrail.assetcodec.observability.ResolutionMissEvent;
import com.questrail.assetcodec.registry.CodecDescriptor;
import com.questrail.assetcodec.registry.CodecRegistry;
import com.questrail.assetcodec.registry.StandardCodecs;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ResourceCodecRuntime
 * =============================================================================
 * Composition root and lifecycle owner for codec work: one registry, one
 * worker pool, one set of limits and one observability sink.
 *
 * <h2>Execution model</h2>
 * Decoding itself is synchronous. {@link #parseAsync} and
 * {@link #serializeAsync} only move a call onto the runtime's workers and
 * report its outcome to the sink.
 *
 * <h2>Reporting</h2>
 * <ul>
 *   <li>No codec for the type id: {@link ResolutionMissEvent}, future completes empty</li>
 *   <li>Parse with diagnostics: {@link DegradedParseEvent}, future completes with the instance</li>
 *   <li>Failure other than cancellation: {@link CodecErrorEvent}, future completes exceptionally</li>
 * </ul>
 */
public final class ResourceCodecRuntime implements AutoCloseable
{
    private final CodecRegistry registry;
    private final ExecutorService executor;
    private final CodecRuntimeConfig config;
    private final CodecObservabilitySink sink;
    private final Clock clock;

    private ResourceCodecRuntime(
            CodecRegistry registry,
            ExecutorService executor,
            CodecRuntimeConfig config,
            CodecObservabilitySink sink,
            Clock clock) {
        this.registry = registry;
        this.executor = executor;
        this.config = config;
        this.sink = sink;
        this.clock = clock;
    }

    public CodecRegistry registry() {
        return registry;
    }

    public CodecRuntimeConfig config() {
        return config;
    }

    /**
     * Parses {@code payload} with the codec currently resolved for {@code typeId}.
     *
     * @return a future holding the parsed instance, or empty if no enabled codec claims {@code typeId}
     */
    public CompletableFuture<Optional<ResourceInstance>> parseAsync(
            ResourceTypeId typeId, byte[] payload, CancellationSignal signal) {
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(signal, "signal");
        return CompletableFuture.supplyAsync(() -> parse(typeId, payload, signal), executor);
    }

    public CompletableFuture<Optional<ResourceInstance>> parseAsync(ResourceTypeId typeId, byte[] payload) {
        return parseAsync(typeId, payload, CancellationSignal.NONE);
    }

    /**
     * Serializes {@code instance} with the highest-ranked enabled codec for its
     * type id that produces its class.
     *
     * <p>The future fails with {@link IllegalStateException} if no such codec is registered.</p>
     */
    public CompletableFuture<byte[]> serializeAsync(ResourceInstance instance, CancellationSignal signal) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(signal, "signal");
        return CompletableFuture.supplyAsync(() -> serialize(instance, signal), executor);
    }

    public CompletableFuture<byte[]> serializeAsync(ResourceInstance instance) {
        return serializeAsync(instance, CancellationSignal.NONE);
    }

    /**
     * Stops accepting work and waits up to the configured grace period for
     * in-flight calls before interrupting them.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    // ---------------------------------------------------------------------
    // Worker-side
    // ---------------------------------------------------------------------

    private Optional<ResourceInstance> parse(ResourceTypeId typeId, byte[] payload, CancellationSignal signal) {
        Optional<CodecDescriptor<?>> resolved = registry.resolve(typeId);
        if (resolved.isEmpty()) {
            sink.onResolutionMiss(new ResolutionMissEvent(clock.instant(), typeId));
            return Optional.empty();
        }

        CodecDescriptor<?> descriptor = resolved.get();
        try {
            ResourceInstance instance = descriptor.codec().parse(payload, signal);
            if (!instance.diagnostics().isEmpty()) {
                sink.onDegradedParse(new DegradedParseEvent(
                        clock.instant(), typeId, descriptor.name(), instance.diagnostics()));
            }
            return Optional.of(instance);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            sink.onError(new CodecErrorEvent(clock.instant(), typeId,
                    "Parse by " + descriptor.name() + " failed: " + e.getMessage(), e));
            throw e;
        }
    }

    private byte[] serialize(ResourceInstance instance, CancellationSignal signal) {
        ResourceTypeId typeId = instance.typeId();
        try {
            for (CodecDescriptor<?> d : registry.snapshot().candidates(typeId)) {
                ResourceCodec<?> codec = d.codec();
                if (codec.resourceClass().isInstance(instance)) {
                    return codec.serializeInstance(instance, signal);
                }
            }
            throw new IllegalStateException("No codec registered for " + typeId
                    + " producing " + instance.getClass().getSimpleName());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            sink.onError(new CodecErrorEvent(clock.instant(), typeId,
                    "Serialize failed: " + e.getMessage(), e));
            throw e;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CodecRuntimeConfig config = CodecRuntimeConfig.defaults();
        private CodecObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private CodecRegistry registry;
        private Clock clock = Clock.systemUTC();

        public Builder withConfig(CodecRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(CodecObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Uses an existing registry instead of creating one. The standard codecs
         * are still added to it if the configuration asks for them.
         */
        public Builder withRegistry(CodecRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ResourceCodecRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");

            CodecRegistry reg = registry != null ? registry : new CodecRegistry(observabilitySink, clock);
            if (config.registerStandardCodecs()) {
                StandardCodecs.registerAll(reg, config.limits());
            }

            ExecutorService workers = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
            return new ResourceCodecRuntime(reg, workers, config, observabilitySink, clock);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "asset-codec-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
