package io.admissionpolicy.cli.config;

import java.util.List;
import java.util.Locale;

/**
 * Configuration of the {@code policy-validator} command.
 *
 * <p>
 * Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param maxDepth      maximum pattern nesting accepted by the anchor walk
 * @param parallelism   number of worker threads validating files
 * @param reportFormat  {@code text} or {@code json}
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  level of the validator's own loggers, upper-cased
 * @param extensions    file suffixes picked up when scanning directories
 */
public record ValidatorConfig(
        int maxDepth,
        int parallelism,
        String reportFormat,
        String loggingFormat,
        String loggingLevel,
        List<String> extensions) {

    public static final String FORMAT_TEXT = "text";
    public static final String FORMAT_JSON = "json";

    private static final List<String> LEVELS = List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public ValidatorConfig {
        if (maxDepth < 1) {
            throw new ConfigLoadException("validation.max-depth must be positive, got " + maxDepth);
        }
        if (parallelism < 1) {
            throw new ConfigLoadException("validation.parallelism must be positive, got " + parallelism);
        }
        reportFormat = requireFormat("report.format", reportFormat);
        loggingFormat = requireFormat("logging.format", loggingFormat);
        loggingLevel = requireLevel(loggingLevel);
        if (extensions == null || extensions.isEmpty()) {
            throw new ConfigLoadException("policies.extensions must list at least one file suffix");
        }
        extensions = List.copyOf(extensions);
    }

    /** Creates a new builder with the default settings. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder seeded with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .maxDepth(maxDepth)
                .parallelism(parallelism)
                .reportFormat(reportFormat)
                .loggingFormat(loggingFormat)
                .loggingLevel(loggingLevel)
                .extensions(extensions);
    }

    private static String requireLevel(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        if (!LEVELS.contains(normalized)) {
            throw new ConfigLoadException("logging.level must be one of " + LEVELS + ", got '" + value + "'");
        }
        return normalized;
    }

    private static String requireFormat(String key, String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (!FORMAT_TEXT.equals(normalized) && !FORMAT_JSON.equals(normalized)) {
            throw new ConfigLoadException(key + " must be 'text' or 'json', got '" + value + "'");
        }
        return normalized;
    }

    /** Builder for {@link ValidatorConfig}. */
    public static final class Builder {
        private int maxDepth = 64;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private String reportFormat = FORMAT_TEXT;
        private String loggingFormat = FORMAT_TEXT;
        private String loggingLevel = "WARN";
        private List<String> extensions = List.of(".yaml", ".yml", ".json");

        Builder() {}

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
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

        public Builder extensions(List<String> extensions) {
            this.extensions = extensions;
            return this;
        }

        public ValidatorConfig build() {
            return new ValidatorConfig(maxDepth, parallelism, reportFormat, loggingFormat, loggingLevel, extensions);
        }
    }
}
