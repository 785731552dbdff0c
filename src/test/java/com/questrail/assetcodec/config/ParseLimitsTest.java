package com.questrail.assetcodec.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ParseLimitsTest
{
    @Test
    void defaults()
    {
        ParseLimits limits = ParseLimits.defaults();
        assertEquals(1_000, limits.maxSectionCount());
        assertEquals(1_024, limits.maxStringLength());
        assertEquals(16 * 1024 * 1024, limits.maxBlobLength());
        assertEquals(limits, ParseLimits.builder().build());
    }

    @Test
    void builderOverridesSingleCeilings()
    {
        ParseLimits limits = ParseLimits.builder().withMaxSectionCount(5).build();
        assertEquals(5, limits.maxSectionCount());
        assertEquals(ParseLimits.DEFAULT_MAX_STRING_LENGTH, limits.maxStringLength());
    }

    @Test
    void nonPositiveCeilingsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> ParseLimits.builder().withMaxBlobLength(0).build());
        assertThrows(IllegalArgumentException.class, () -> new ParseLimits(1, -1, 1));
    }

    @Test
    void runtimeConfigDefaultsAndValidation()
    {
        CodecRuntimeConfig config = CodecRuntimeConfig.defaults();
        assertEquals(Duration.ofSeconds(5), config.shutdownGrace());
        assertTrue(config.registerStandardCodecs());
        assertTrue(config.workerThreads() >= 1);

        assertThrows(IllegalArgumentException.class,
                () -> CodecRuntimeConfig.builder().withWorkerThreads(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> CodecRuntimeConfig.builder().withShutdownGrace(Duration.ofSeconds(-1)).build());
        assertThrows(NullPointerException.class,
                () -> CodecRuntimeConfig.builder().withLimits(null).build());
    }
}
