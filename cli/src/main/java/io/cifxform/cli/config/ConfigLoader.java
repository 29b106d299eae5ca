package io.cifxform.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code cif-xform.yaml} from the current directory if it exists, otherwise
 * starts from the defaults</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the given path, which must exist</li>
 * </ul>
 *
 * <p>Every key can be overridden by an environment variable, which takes precedence over the YAML
 * value. A variable counts as set only if it is defined and non-blank after trimming.
 *
 * <pre>
 * dictionary.path              CIF_DICTIONARY
 * dictionary.extensions        CIF_EXTENSIONS
 * format.prefer-triple-quotes  CIF_PREFER_TRIPLE_QUOTES
 * output.report                CIF_REPORT_FORMAT
 * logging.format               LOGGING_FORMAT
 * logging.level                LOGGING_LEVEL
 * </pre>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file looked up in the working directory when no {@code --config} is given. */
    public static final String DEFAULT_CONFIG_FILE = "cif-xform.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link CliConfig} from the given YAML file, applying overrides from {@link
     * System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link CliConfig} from the given YAML file, applying overrides from the supplied
     * lookup function. The function returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Loads the configuration named by {@code --config}, or the default file when present, or the
     * defaults. Environment overrides apply in every case.
     */
    public static CliConfig resolve(String explicitPath, Path workingDir, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(Path.of(explicitPath), envLookup);
        }
        Path fallback = workingDir.resolve(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return mapToConfig(null, envLookup);
    }

    /** Maps a parsed YAML tree (or {@code null}) to a config via the builder, then overlays env vars. */
    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            JsonNode dictionary = root.path("dictionary");
            if (dictionary.has("path")) builder.dictionaryPath(dictionary.get("path").asText());
            if (dictionary.has("extensions"))
                builder.extensionsPath(dictionary.get("extensions").asText());

            JsonNode format = root.path("format");
            if (format.has("prefer-triple-quotes"))
                builder.preferTripleQuotes(format.get("prefer-triple-quotes").asBoolean());

            JsonNode output = root.path("output");
            if (output.has("report")) builder.reportFormat(output.get("report").asText());

            JsonNode logging = root.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        }

        envString(envLookup, "CIF_DICTIONARY", builder::dictionaryPath);
        envString(envLookup, "CIF_EXTENSIONS", builder::extensionsPath);
        envBool(envLookup, "CIF_PREFER_TRIPLE_QUOTES", builder::preferTripleQuotes);
        envString(envLookup, "CIF_REPORT_FORMAT", builder::reportFormat);
        envString(envLookup, "LOGGING_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOGGING_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    // --- Env var helpers ---

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

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
