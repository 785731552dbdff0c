package com.questrail.assetcodec.codec.layout;

import com.questrail.assetcodec.codec.ParseContext;

/**
 * Reads one section of a payload into the instance being built.
 */
@FunctionalInterface
public interface SectionReader<T>
{
    void read(ParseContext ctx, T target);
}
