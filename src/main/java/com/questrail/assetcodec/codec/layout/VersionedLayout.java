package com.questrail.assetcodec.codec.layout;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.codec.ParseContext;
import com.questrail.assetcodec.codec.io.ResourceWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * VersionedLayout
 * =============================================================================
 * Ordered list of {@link VersionedSection}s describing a format's byte layout
 * across all of its versions.
 *
 * <p>Reading and writing walk the same list in the same order and visit a
 * section only if the payload version reaches the section's
 * {@code minVersion}. A section introduced in version 10 is therefore never
 * read from, nor written to, a version 9 payload.</p>
 *
 * <p>Version thresholds belong to the format that declares the layout; this
 * class knows nothing about any particular format.</p>
 */
public final class VersionedLayout<T>
{
    private final List<VersionedSection<T>> sections;

    private VersionedLayout(List<VersionedSection<T>> sections) {
        this.sections = List.copyOf(sections);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public List<VersionedSection<T>> sections() {
        return sections;
    }

    /**
     * Returns the names of the sections present in payloads of {@code version}, in order.
     */
    public List<String> activeSections(long version) {
        List<String> names = new ArrayList<>();
        for (VersionedSection<T> s : sections) {
            if (s.isPresentIn(version)) {
                names.add(s.name());
            }
        }
        return names;
    }

    /**
     * Reads every section present in {@code version}.
     *
     * <p>An abandoned optional section keeps its defaults. Reading carries on
     * with the next section while the reader is still aligned; once it is not,
     * {@link ParseContext#readSection} skips the remaining sections and notes
     * each of them.</p>
     *
     * @return {@code true} if no section was abandoned or skipped
     */
    public boolean read(long version, ParseContext ctx, T target) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(target, "target");
        boolean complete = true;
        for (VersionedSection<T> s : sections) {
            if (!s.isPresentIn(version)) {
                continue;
            }
            ctx.checkpoint();
            if (s.mandatory()) {
                s.reader().read(ctx, target);
            }
            else {
                SectionResult<Void> result = ctx.readSection(s.name(), in -> {
                    s.reader().read(ctx, target);
                    return null;
                });
                complete &= result.isOk();
            }
        }
        return complete;
    }

    public void write(long version, ResourceWriter out, T source, CancellationSignal signal) {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(source, "source");
        for (VersionedSection<T> s : sections) {
            if (s.isPresentIn(version)) {
                signal.throwIfCancelled();
                s.writer().write(out, source, signal);
            }
        }
    }

    public static final class Builder<T> {
        private final List<VersionedSection<T>> sections = new ArrayList<>();

        /**
         * Adds a section whose failure fails the whole parse.
         */
        public Builder<T> mandatory(String name, long minVersion, SectionReader<T> reader, SectionWriter<T> writer) {
            sections.add(new VersionedSection<>(name, minVersion, true, reader, writer));
            return this;
        }

        /**
         * Adds a section that degrades instead of failing.
         */
        public Builder<T> optional(String name, long minVersion, SectionReader<T> reader, SectionWriter<T> writer) {
            sections.add(new VersionedSection<>(name, minVersion, false, reader, writer));
            return this;
        }

        public VersionedLayout<T> build() {
            return new VersionedLayout<>(sections);
        }
    }
}
