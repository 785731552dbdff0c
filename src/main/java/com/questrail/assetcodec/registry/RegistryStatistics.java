package com.questrail.assetcodec.registry;

import java.util.Map;

/**
 * Point-in-time counters describing a {@link CodecRegistry}.
 *
 * @param registrationCount       registrations, enabled or not
 * @param disabledCount           registrations currently disabled
 * @param distinctTypeIds         type ids with at least one enabled codec
 * @param aliasCount              bound mnemonics
 * @param registrationsByPriority registrations grouped by priority
 * @param resolveCount            {@code resolve} calls since the registry was created
 * @param missCount               {@code resolve} calls that found no codec
 */
public record RegistryStatistics(
    int registrationCount,
    int disabledCount,
    int distinctTypeIds,
    int aliasCount,
    Map<Integer, Integer> registrationsByPriority,
    long resolveCount,
    long missCount
) {
    public RegistryStatistics {
        registrationsByPriority = Map.copyOf(registrationsByPriority);
    }

    /**
     * Fraction of {@code resolve} calls that found a codec, or {@code 0.0} if
     * none were made.
     */
    public double hitRatio() {
        return resolveCount == 0 ? 0.0 : (double) (resolveCount - missCount) / resolveCount;
    }
}
