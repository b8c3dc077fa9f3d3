package io.admissionpolicy.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ValidatorConfig} from an optional YAML file with an
 * environment variable overlay.
 *
 * <p>
 * Recognized YAML keys:
 * <pre>
 * validation:
 *   max-depth: 64
 *   parallelism: 4
 * report:
 *   format: text
 * logging:
 *   format: text
 *   level: WARN
 * policies:
 *   extensions: [.yaml, .yml, .json]
 * </pre>
 *
 * <p>
 * Env vars take precedence over YAML values. A variable counts as set only
 * when it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "policy-validator.yaml";

    static final String ENV_MAX_DEPTH = "POLICY_MAX_DEPTH";
    static final String ENV_PARALLELISM = "POLICY_PARALLELISM";
    static final String ENV_REPORT_FORMAT = "REPORT_FORMAT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "LOG_LEVEL";
    static final String ENV_EXTENSIONS = "POLICY_EXTENSIONS";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ValidatorConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from
     * {@code envLookup}. The lookup returns {@code null} for undefined
     * variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ValidatorConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root != null && !root.isMissingNode() && !root.isNull() && !root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }

        ValidatorConfig.Builder builder = ValidatorConfig.builder();
        if (root != null && root.isObject()) {
            applyYaml(root, builder);
        }
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /** Builds configuration from defaults and environment variables only. */
    public static ValidatorConfig fromEnvironment(Function<String, String> envLookup) {
        ValidatorConfig.Builder builder = ValidatorConfig.builder();
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /**
     * Picks the configuration source: the explicit path when given (it must
     * exist), else {@value #DEFAULT_CONFIG_FILE} in {@code workingDir} if
     * present, else defaults plus environment.
     */
    public static ValidatorConfig resolve(Path explicitPath, Path workingDir, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        Path fallback = workingDir.resolve(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(fallback)) {
            return load(fallback, envLookup);
        }
        return fromEnvironment(envLookup);
    }

    private static void applyYaml(JsonNode root, ValidatorConfig.Builder builder) {
        JsonNode validation = root.path("validation");
        if (validation.has("max-depth")) builder.maxDepth(intValue(validation, "max-depth"));
        if (validation.has("parallelism")) builder.parallelism(intValue(validation, "parallelism"));

        JsonNode report = root.path("report");
        if (report.has("format")) builder.reportFormat(report.get("format").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode policies = root.path("policies");
        if (policies.has("extensions")) {
            JsonNode extensions = policies.get("extensions");
            if (extensions.isArray()) {
                List<String> values = new ArrayList<>();
                extensions.forEach(node -> values.add(node.asText()));
                builder.extensions(normalizeExtensions(values));
            } else {
                builder.extensions(splitExtensions(extensions.asText()));
            }
        }
    }

    private static int intValue(JsonNode section, String key) {
        JsonNode node = section.get(key);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ConfigLoadException(key + " must be an integer, got '" + node.asText() + "'");
        }
        return node.intValue();
    }

    private static void applyEnvOverrides(ValidatorConfig.Builder builder, Function<String, String> envLookup) {
        envInt(envLookup, ENV_MAX_DEPTH, builder::maxDepth);
        envInt(envLookup, ENV_PARALLELISM, builder::parallelism);
        envString(envLookup, ENV_REPORT_FORMAT, builder::reportFormat);
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);
        envString(envLookup, ENV_EXTENSIONS, value -> builder.extensions(splitExtensions(value)));
    }

    // --- Env var helpers ---

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
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    static List<String> splitExtensions(String value) {
        return normalizeExtensions(Arrays.asList(value.split(",")));
    }

    // ".yaml", "yaml" and " YAML " all mean the same suffix.
    private static List<String> normalizeExtensions(List<String> raw) {
        List<String> result = new ArrayList<>();
        for (String entry : raw) {
            String trimmed = entry.trim().toLowerCase(Locale.ROOT);
            if (trimmed.isEmpty()) {
                continue;
            }
            String suffix = trimmed.startsWith(".") ? trimmed : "." + trimmed;
            if (!result.contains(suffix)) {
                result.add(suffix);
            }
        }
        return result;
    }
}
