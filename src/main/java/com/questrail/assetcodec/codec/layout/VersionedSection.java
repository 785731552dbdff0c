package com.questrail.assetcodec.codec.layout;

import java.util.Objects;

/**
 * One entry of a {@link VersionedLayout}: a named section that is present in
 * payloads whose version is at least {@code minVersion}.
 *
 * @param mandatory whether a failure inside the section fails the whole parse
 *                  instead of degrading the section
 */
public record VersionedSection<T>(
    String name,
    long minVersion,
    boolean mandatory,
    SectionReader<T> reader,
    SectionWriter<T> writer
) {
    public VersionedSection {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(writer, "writer");
        if (minVersion < 0) {
            throw new IllegalArgumentException("minVersion must be >= 0");
        }
    }

    public boolean isPresentIn(long version) {
        return version >= minVersion;
    }
}
