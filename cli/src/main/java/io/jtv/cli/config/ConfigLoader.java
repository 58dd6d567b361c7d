package io.jtv.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link CliConfig} from an optional YAML file with an environment variable overlay.
 *
 * <p>YAML layout:
 *
 * <pre>
 * limits:
 *   max-steps: 1000000
 *   max-call-depth: 256
 * numeric:
 *   integer-bits: 0
 * logging:
 *   format: text
 *   level: WARN
 * trace: false
 * </pre>
 *
 * <p>Environment variables take precedence over YAML values: {@code JTV_MAX_STEPS},
 * {@code JTV_MAX_CALL_DEPTH}, {@code JTV_INTEGER_BITS}, {@code JTV_LOG_FORMAT},
 * {@code JTV_LOG_LEVEL}, {@code JTV_TRACE}. A variable is "set" if and only if it is defined and its
 * trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, invalid, or holds out-of-range values
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying the supplied environment.
     *
     * @param envLookup maps variable names to values; {@code null} means undefined
     * @throws ConfigLoadException if the file is missing, invalid, or holds out-of-range values
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Defaults with the environment overlay, for runs without a configuration file. */
    public static CliConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    /**
     * Finds the {@code --config <path>} option in the command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Optional<Path> resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Optional.of(Path.of(args[i + 1]));
            }
        }
        return Optional.empty();
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        // --- YAML mapping ---

        JsonNode limits = root.path("limits");
        if (limits.has("max-steps")) builder.maxSteps(limits.get("max-steps").asLong());
        if (limits.has("max-call-depth")) builder.maxCallDepth(limits.get("max-call-depth").asInt());

        JsonNode numeric = root.path("numeric");
        if (numeric.has("integer-bits")) builder.integerBits(numeric.get("integer-bits").asInt());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        if (root.has("trace")) builder.trace(root.get("trace").asBoolean());

        // --- Environment variable overlay ---

        envLong(envLookup, "JTV_MAX_STEPS", builder::maxSteps);
        envInt(envLookup, "JTV_MAX_CALL_DEPTH", builder::maxCallDepth);
        envInt(envLookup, "JTV_INTEGER_BITS", builder::integerBits);
        envString(envLookup, "JTV_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "JTV_LOG_LEVEL", builder::loggingLevel);
        envBool(envLookup, "JTV_TRACE", builder::trace);

        try {
            CliConfig config = builder.build();
            config.toEngineOptions();
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
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
            setter.accept(parse(envVar, envLookup.apply(envVar), Integer::parseInt));
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parse(envVar, envLookup.apply(envVar), Long::parseLong));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static <T> T parse(String envVar, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(envVar + " must be a number, got: '" + raw + "'", e);
        }
    }
}
