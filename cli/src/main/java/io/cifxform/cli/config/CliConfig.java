package io.cifxform.cli.config;

import java.util.Locale;
import java.util.Set;

/**
 * Configuration for the cif-xform command line.
 *
 * <p>Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param dictionaryPath path to the DDLm dictionary, or {@code null} when not configured
 * @param extensionsPath path to a CIF2-only extension table, or {@code null} for the bundled one
 * @param preferTripleQuotes encode multiline values with triple quotes instead of text blocks
 * @param reportFormat {@code text} or {@code json}
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel root log level
 */
public record CliConfig(
        String dictionaryPath,
        String extensionsPath,
        boolean preferTripleQuotes,
        String reportFormat,
        String loggingFormat,
        String loggingLevel) {

    private static final Set<String> FORMATS = Set.of("text", "json");

    public CliConfig {
        reportFormat = normalizeFormat(reportFormat, "output.report");
        loggingFormat = normalizeFormat(loggingFormat, "logging.format");
        loggingLevel = loggingLevel != null ? loggingLevel.toUpperCase(Locale.ROOT) : "INFO";
    }

    private static String normalizeFormat(String value, String key) {
        if (value == null) {
            return "text";
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (!FORMATS.contains(lower)) {
            throw new ConfigLoadException("Invalid " + key + ": '" + value + "' (expected text or json)");
        }
        return lower;
    }

    /** Returns {@code true} if reports are written as JSON. */
    public boolean jsonReport() {
        return "json".equals(reportFormat);
    }

    /** A configuration with all defaults. */
    public static CliConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {

        private String dictionaryPath;
        private String extensionsPath;
        private boolean preferTripleQuotes;
        private String reportFormat = "text";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder dictionaryPath(String dictionaryPath) {
            this.dictionaryPath = dictionaryPath;
            return this;
        }

        public Builder extensionsPath(String extensionsPath) {
            this.extensionsPath = extensionsPath;
            return this;
        }

        public Builder preferTripleQuotes(boolean preferTripleQuotes) {
            this.preferTripleQuotes = preferTripleQuotes;
            return this;
        }

        public Builder reportFormat(String reportFormat) {
            this.reportFormat = reportFormat;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(
                    dictionaryPath, extensionsPath, preferTripleQuotes, reportFormat, loggingFormat, loggingLevel);
        }
    }
}
