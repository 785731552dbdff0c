package com.questrail.assetcodec.codec.layout;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.codec.io.ResourceWriter;

/**
 * Writes one section of a payload from an instance.
 */
@FunctionalInterface
public interface SectionWriter<T>
{
    void write(ResourceWriter out, T source, CancellationSignal signal);
}
