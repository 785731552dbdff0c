package com.questrail.assetcodec.resources.ngmp;

/**
 * One entry of an {@link NgmpResource}: a 64-bit name hash and the 64-bit
 * instance id it maps to. Both are unsigned on the wire and held as their bit
 * patterns.
 */
public record NamePair(long nameHash, long instance) {
}
