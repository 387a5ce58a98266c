package io.symdiff.cli.config;

import io.symdiff.core.engine.EngineOptions;
import java.util.List;
import java.util.Locale;

/**
 * Resolved configuration of one CLI invocation. Every field has a default; use {@link
 * #builder()} to construct instances.
 *
 * @param simplifyOnParse build parsed trees through the simplifier ({@code
 *     engine.simplify-on-parse})
 * @param maxNestingDepth parser nesting limit ({@code engine.max-nesting-depth})
 * @param domain {@code auto}, {@code real} or {@code complex} ({@code engine.domain})
 * @param outputFormat {@code text} or {@code json} ({@code output.format})
 * @param loggingFormat {@code text} or {@code json} ({@code logging.format})
 * @param loggingLevel root log level ({@code logging.level})
 */
public record CliConfig(
        boolean simplifyOnParse,
        int maxNestingDepth,
        String domain,
        String outputFormat,
        String loggingFormat,
        String loggingLevel) {

    public static final String DOMAIN_AUTO = "auto";

    static final List<String> DOMAINS = List.of(DOMAIN_AUTO, "real", "complex");
    static final List<String> FORMATS = List.of("text", "json");
    static final List<String> LEVELS = List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    /** Engine options derived from the {@code engine} section. */
    public EngineOptions engineOptions() {
        return new EngineOptions(simplifyOnParse, maxNestingDepth);
    }

    /** Returns a copy with the domain and output format replaced where the overrides are non-null. */
    public CliConfig withOverrides(String domainOverride, String outputFormatOverride) {
        return toBuilder()
                .domain(domainOverride != null ? domainOverride : domain)
                .outputFormat(outputFormatOverride != null ? outputFormatOverride : outputFormat)
                .build();
    }

    public Builder toBuilder() {
        return builder()
                .simplifyOnParse(simplifyOnParse)
                .maxNestingDepth(maxNestingDepth)
                .domain(domain)
                .outputFormat(outputFormat)
                .loggingFormat(loggingFormat)
                .loggingLevel(loggingLevel);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. All fields have defaults. */
    public static final class Builder {
        private boolean simplifyOnParse = false;
        private int maxNestingDepth = EngineOptions.DEFAULT.maxNestingDepth();
        private String domain = DOMAIN_AUTO;
        private String outputFormat = "text";
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder simplifyOnParse(boolean simplifyOnParse) {
            this.simplifyOnParse = simplifyOnParse;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
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

        /**
         * Builds the configuration. Enumerated values are normalized to lower case (the log level
         * to upper case).
         *
         * @throws ConfigLoadException if a value is outside its allowed set
         */
        public CliConfig build() {
            if (maxNestingDepth <= 0) {
                throw new ConfigLoadException(
                        "engine.max-nesting-depth must be a positive integer, got: " + maxNestingDepth);
            }
            return new CliConfig(
                    simplifyOnParse,
                    maxNestingDepth,
                    oneOf("engine.domain", domain, DOMAINS, false),
                    oneOf("output.format", outputFormat, FORMATS, false),
                    oneOf("logging.format", loggingFormat, FORMATS, false),
                    oneOf("logging.level", loggingLevel, LEVELS, true));
        }

        private static String oneOf(String key, String value, List<String> allowed, boolean upperCase) {
            String normalized = value == null
                    ? null
                    : upperCase ? value.trim().toUpperCase(Locale.ROOT) : value.trim().toLowerCase(Locale.ROOT);
            if (normalized == null || !allowed.contains(normalized)) {
                throw new ConfigLoadException(
                        "Invalid value for " + key + ": '" + value + "'. Expected one of " + allowed);
            }
            return normalized;
        }
    }
}
