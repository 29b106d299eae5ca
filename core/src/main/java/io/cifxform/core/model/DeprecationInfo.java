package io.cifxform.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Deprecation status of one data name.
 *
 * @param fieldName the deprecated name, as spelled in the dictionary
 * @param deprecated always {@code true} for recorded entries
 * @param replacementField the modern replacement, or {@code null}
 * @param deprecationDate the alias deprecation date, or {@code null}
 * @param reason free-text reason
 * @param severity {@link Severity#WARNING} for an explicit marker, {@link Severity#INFO} when
 *     inferred from the description only
 */
public record DeprecationInfo(
        String fieldName,
        boolean deprecated,
        String replacementField,
        String deprecationDate,
        String reason,
        Severity severity) {

    /** How firmly the dictionary states the deprecation. */
    public enum Severity {
        WARNING,
        INFO;

        /** Lowercase label, e.g. {@code "warning"}. */
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public DeprecationInfo {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }
}
