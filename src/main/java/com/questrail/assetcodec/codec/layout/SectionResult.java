package com.questrail.assetcodec.codec.layout;

import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.api.ParseDiagnostic;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of reading one optional section: either the section's data, or the
 * reason it was abandoned.
 */
public sealed interface SectionResult<T> permits SectionResult.Ok, SectionResult.Degraded
{
    static <T> SectionResult<T> ok(T value) {
        return new Ok<>(value);
    }

    boolean isOk();

    /**
     * Returns the section's value, or {@code fallback} if the section was abandoned.
     */
    T orElse(T fallback);

    Optional<T> value();

    record Ok<T>(T data) implements SectionResult<T>
    {
        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T orElse(T fallback) {
            return data;
        }

        @Override
        public Optional<T> value() {
            return Optional.ofNullable(data);
        }
    }

    record Degraded<T>(String section, DegradationReason reason, int offset, String detail)
            implements SectionResult<T>
    {
        public Degraded {
            Objects.requireNonNull(section, "section");
            Objects.requireNonNull(reason, "reason");
            detail = detail == null ? reason.name() : detail;
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T orElse(T fallback) {
            return fallback;
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }

        public ParseDiagnostic toDiagnostic() {
            return new ParseDiagnostic(section, reason, offset, detail, true);
        }
    }
}
