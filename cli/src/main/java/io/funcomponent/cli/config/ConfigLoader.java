package io.funcomponent.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.funcomponent.core.model.CaptureMode;
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

/**
 * Loads {@link CompilerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Recognized YAML layout:
 *
 * <pre>
 * compiler:
 *   base-image: python:3.9
 *   capture-mode: source-copy | closure-serialization
 *   packages: [pandas==1.3.0]
 *   modules-to-capture: [my_module]
 *   extra-code: |
 *     import math
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>Environment variables take precedence over YAML values. A variable counts as set only if it
 * is defined and non-blank after trimming. {@code FUNC_COMPONENT_PACKAGES} is a comma-separated
 * list.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file used when no {@code --config} argument is given. */
    public static final String DEFAULT_CONFIG_FILE = "func-component.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given file with overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CompilerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given file with overrides from the supplied lookup. A missing
     * file is an error; use {@link #defaults(Function)} to start from defaults only.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup, returning null for undefined variables
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CompilerConfig load(Path configPath, Function<String, String> envLookup) {
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

    /** Returns the default configuration with environment overrides applied. */
    public static CompilerConfig defaults(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static CompilerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CompilerConfig.Builder builder = CompilerConfig.builder();

        JsonNode compiler = root.path("compiler");
        if (compiler.has("base-image")) builder.baseImage(compiler.get("base-image").asText());
        if (compiler.has("capture-mode"))
            builder.captureMode(parseCaptureMode(compiler.get("capture-mode").asText()));
        if (compiler.has("packages")) builder.packagesToInstall(stringList(compiler.get("packages"), "packages"));
        if (compiler.has("modules-to-capture"))
            builder.modulesToCapture(stringList(compiler.get("modules-to-capture"), "modules-to-capture"));
        if (compiler.has("extra-code")) builder.extraCode(compiler.get("extra-code").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        envString(envLookup, "FUNC_COMPONENT_BASE_IMAGE", builder::baseImage);
        envString(envLookup, "FUNC_COMPONENT_CAPTURE_MODE", value -> builder.captureMode(parseCaptureMode(value)));
        envString(envLookup, "FUNC_COMPONENT_PACKAGES", value -> builder.packagesToInstall(splitList(value)));
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    /** Accepts {@code source-copy} / {@code closure-serialization} in any case, or the enum names. */
    static CaptureMode parseCaptureMode(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return CaptureMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Invalid capture mode '" + value + "'. Expected 'source-copy' or 'closure-serialization'.", e);
        }
    }

    private static List<String> stringList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException("compiler." + key + " must be a list");
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> values.add(item.asText()));
        return values;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /** Applies a string env var override if the variable is defined and non-blank. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        String value = envLookup.apply(envVar);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }
}
