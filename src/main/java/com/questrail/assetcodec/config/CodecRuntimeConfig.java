package com.questrail.assetcodec.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the codec runtime.
 *
 * @param limits                 ceilings applied while parsing
 * @param workerThreads          size of the executor that runs asynchronous parse and serialize calls
 * @param shutdownGrace          how long {@code close()} waits for in-flight work before interrupting it
 * @param registerStandardCodecs whether the built-in codecs are registered at start-up
 */
public record CodecRuntimeConfig(
    ParseLimits limits,
    int workerThreads,
    Duration shutdownGrace,
    boolean registerStandardCodecs
) {
    public CodecRuntimeConfig {
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0, was " + workerThreads);
        }
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must not be negative");
        }
    }

    public static CodecRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ParseLimits limits = ParseLimits.defaults();
        private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors());
        private Duration shutdownGrace = Duration.ofSeconds(5);
        private boolean registerStandardCodecs = true;

        public Builder withLimits(ParseLimits limits) {
            this.limits = limits;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder withStandardCodecs(boolean registerStandardCodecs) {
            this.registerStandardCodecs = registerStandardCodecs;
            return this;
        }

        public CodecRuntimeConfig build() {
            return new CodecRuntimeConfig(limits, workerThreads, shutdownGrace, registerStandardCodecs);
        }
    }
}
