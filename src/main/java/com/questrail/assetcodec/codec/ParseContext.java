package com.questrail.assetcodec.codec;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.api.ParseDiagnostic;
import com.questrail.assetcodec.codec.io.ResourceReader;
import com.questrail.assetcodec.codec.layout.SectionResult;
import com.questrail.assetcodec.config.ParseLimits;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * State of one parse call: the reader, the active limits, the cancellation
 * signal and the diagnostics collected so far.
 *
 * <p>{@link #readSection} is the only place where a {@link ResourceParseException}
 * is turned into a degradation. Anything read outside it is mandatory and
 * fails the whole parse.</p>
 *
 * <p>An abandoned section leaves the reader aligned only when the failure was
 * {@linkplain ResourceParseException#resumable() resumable} and no record of
 * the section had been started. Otherwise the reader position no longer marks
 * the start of anything, and every later section is skipped with a note.</p>
 */
public final class ParseContext
{
    private final ResourceReader reader;
    private final ParseLimits limits;
    private final CancellationSignal signal;
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
    private int recordsInSection;
    private SectionResult.Degraded<?> lostAlignment;

    public ParseContext(ResourceReader reader, ParseLimits limits, CancellationSignal signal)
    {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.signal = Objects.requireNonNull(signal, "signal");
    }

    public ResourceReader reader()
    {
        return reader;
    }

    public ParseLimits limits()
    {
        return limits;
    }

    /**
     * Throws {@link java.util.concurrent.CancellationException} if the parse has
     * been cancelled. Called once per record by bulk sections, before the
     * record's first field is read.
     */
    public void checkpoint()
    {
        signal.throwIfCancelled();
        recordsInSection++;
    }

    /**
     * Whether the reader still marks the start of the next section.
     */
    public boolean isAligned()
    {
        return lostAlignment == null;
    }

    /**
     * Reads one optional section.
     *
     * <p>The body must assign nothing to the instance being built until it has
     * read the whole section, so that an abandoned section leaves the instance
     * exactly as it was before the section started.</p>
     *
     * @return {@link SectionResult.Ok} with the body's value, or
     *         {@link SectionResult.Degraded} if the body raised a
     *         {@link ResourceParseException}; a degradation is also recorded in
     *         {@link #diagnostics()}. If an earlier section lost alignment the
     *         body is not run and the section is noted as skipped.
     */
    public <T> SectionResult<T> readSection(String name, Function<ResourceReader, T> body)
    {
        final int start = reader.position();
        if (lostAlignment != null) {
            String detail = "Not read because section '" + lostAlignment.section() + "' was abandoned";
            note(name, lostAlignment.reason(), start, detail);
            return new SectionResult.Degraded<>(name, lostAlignment.reason(), start, detail);
        }
        recordsInSection = 0;
        try {
            return SectionResult.ok(body.apply(reader));
        }
        catch (ResourceParseException e) {
            SectionResult.Degraded<T> degraded =
                    new SectionResult.Degraded<>(name, e.reason(), start, e.getMessage());
            diagnostics.add(degraded.toDiagnostic());
            if (!e.resumable() || recordsInSection > 0) {
                lostAlignment = degraded;
            }
            return degraded;
        }
    }

    /**
     * Records an anomaly that did not prevent the section from being read and
     * does not clear the instance's validity flag.
     */
    public void note(String section, DegradationReason reason, int offset, String detail)
    {
        diagnostics.add(new ParseDiagnostic(section, reason, offset, detail, false));
    }

    /**
     * Records an anomaly that clears the instance's validity flag although the
     * section itself was read.
     */
    public void degrade(String section, DegradationReason reason, int offset, String detail)
    {
        diagnostics.add(new ParseDiagnostic(section, reason, offset, detail, true));
    }

    /**
     * Degrades {@code section} if bytes remain after the last field of a format
     * that defines no trailer. Such bytes are dropped on re-serialization.
     */
    public void expectEnd(String section)
    {
        if (reader.hasRemaining()) {
            degrade(section, DegradationReason.INVALID_LENGTH, reader.position(),
                    reader.remaining() + " unexpected trailing bytes ignored");
        }
    }

    public List<ParseDiagnostic> diagnostics()
    {
        return List.copyOf(diagnostics);
    }
}
