package io.symdiff.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Supports three invocation patterns:
 *
 * <ul>
 * <li>{@code --config /path/to/symdiff.yaml}: loads from the given path, which must exist
 * <li>otherwise {@code symdiff.yaml} in the working directory, if present
 * <li>otherwise defaults only
 * </ul>
 *
 * <p>Every key can be overridden by an environment variable, which takes precedence over the
 * YAML value. A variable counts as set only when it is defined and its trimmed value is
 * non-empty.
 *
 * <table>
 * <caption>Keys</caption>
 * <tr><th>YAML key</th><th>Environment variable</th></tr>
 * <tr><td>engine.simplify-on-parse</td><td>SYMDIFF_SIMPLIFY_ON_PARSE</td></tr>
 * <tr><td>engine.max-nesting-depth</td><td>SYMDIFF_MAX_NESTING_DEPTH</td></tr>
 * <tr><td>engine.domain</td><td>SYMDIFF_DOMAIN</td></tr>
 * <tr><td>output.format</td><td>SYMDIFF_OUTPUT_FORMAT</td></tr>
 * <tr><td>logging.format</td><td>SYMDIFF_LOG_FORMAT</td></tr>
 * <tr><td>logging.level</td><td>SYMDIFF_LOG_LEVEL</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file picked up from the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "symdiff.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolves the configuration for one invocation.
     *
     * @param explicitPath the {@code --config} value, or {@code null}
     * @param workingDirectory directory searched for {@value #DEFAULT_CONFIG_FILE}
     * @param envLookup environment variable lookup; {@code null} means undefined
     * @throws ConfigLoadException if an explicit file is missing or any source is invalid
     */
    public static CliConfig resolve(String explicitPath, Path workingDirectory, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(Path.of(explicitPath), envLookup);
        }
        Path implicit = workingDirectory.resolve(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(implicit)) {
            return load(implicit, envLookup);
        }
        LOG.debug("No {} in {}, using defaults", DEFAULT_CONFIG_FILE, workingDirectory);
        return defaults(envLookup);
    }

    /**
     * Loads a config file, applying overrides from {@code envLookup}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root != null && !root.isMissingNode() && !root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }

        CliConfig config = mapToConfig(root, envLookup);
        LOG.debug("Configuration loaded from {}", configPath);
        return config;
    }

    /** Defaults plus environment overrides, no file. */
    public static CliConfig defaults(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup);
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        if (root != null) {
            JsonNode engine = root.path("engine");
            if (engine.has("simplify-on-parse"))
                builder.simplifyOnParse(booleanValue(engine, "engine.simplify-on-parse", "simplify-on-parse"));
            if (engine.has("max-nesting-depth"))
                builder.maxNestingDepth(intValue(engine, "engine.max-nesting-depth", "max-nesting-depth"));
            if (engine.has("domain")) builder.domain(engine.get("domain").asText());

            JsonNode output = root.path("output");
            if (output.has("format")) builder.outputFormat(output.get("format").asText());

            JsonNode logging = root.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        }

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envBool(envLookup, "SYMDIFF_SIMPLIFY_ON_PARSE", builder::simplifyOnParse);
        envInt(envLookup, "SYMDIFF_MAX_NESTING_DEPTH", builder::maxNestingDepth);
        envString(envLookup, "SYMDIFF_DOMAIN", builder::domain);
        envString(envLookup, "SYMDIFF_OUTPUT_FORMAT", builder::outputFormat);
        envString(envLookup, "SYMDIFF_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "SYMDIFF_LOG_LEVEL", builder::loggingLevel);
    }

    private static boolean booleanValue(JsonNode section, String key, String field) {
        JsonNode node = section.get(field);
        if (!node.isBoolean()) {
            throw new ConfigLoadException(key + " must be true or false, got: " + node.asText());
        }
        return node.booleanValue();
    }

    private static int intValue(JsonNode section, String key, String field) {
        JsonNode node = section.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigLoadException(key + " must be an integer, got: " + node.asText());
        }
        return node.intValue();
    }

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                throw new ConfigLoadException(envVar + " must be true or false, got: " + value);
            }
            setter.accept(Boolean.parseBoolean(value));
        }
    }
}
