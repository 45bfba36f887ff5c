package io.eventmatch.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Loads {@link EvaluatorOptions} from a YAML file with an environment variable overlay.
 *
 * <p>
 * YAML layout (all keys optional, missing keys keep the {@link EvaluatorOptions#DEFAULT} values):
 *
 * <pre>
 * numeric-comparisons:
 *   heterogeneous: true
 * program-cache:
 *   size: 0
 * expression:
 *   max-length: 100000
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable ({@code EVENTMATCH_HETEROGENEOUS_NUMERIC},
 * {@code EVENTMATCH_PROGRAM_CACHE_SIZE}, {@code EVENTMATCH_MAX_EXPRESSION_LENGTH}). An env var is
 * considered set only if it is defined and its trimmed value is non-empty.
 */
public final class OptionsLoader {

    static final String ENV_HETEROGENEOUS = "EVENTMATCH_HETEROGENEOUS_NUMERIC";
    static final String ENV_CACHE_SIZE = "EVENTMATCH_PROGRAM_CACHE_SIZE";
    static final String ENV_MAX_LENGTH = "EVENTMATCH_MAX_EXPRESSION_LENGTH";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private OptionsLoader() {
        // utility class
    }

    /**
     * Loads options from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws OptionsLoadException if the file is missing, unparsable, or holds invalid values
     */
    public static EvaluatorOptions load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads options from {@code configPath}, applying overrides from the supplied lookup function.
     * The lookup returns {@code null} for undefined variables.
     *
     * @throws OptionsLoadException if the file is missing, unparsable, or holds invalid values
     */
    public static EvaluatorOptions load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new OptionsLoadException("Options file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new OptionsLoadException("Failed to parse YAML options: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return overlay(EvaluatorOptions.DEFAULT, envLookup);
        }
        if (!root.isObject()) {
            throw new OptionsLoadException("Options file must contain a YAML mapping: " + configPath);
        }
        return overlay(fromYaml(root), envLookup);
    }

    /** Applies environment overrides to {@code base}. */
    public static EvaluatorOptions overlay(EvaluatorOptions base, Function<String, String> envLookup) {
        EvaluatorOptions options = base;
        String heterogeneous = env(envLookup, ENV_HETEROGENEOUS);
        if (heterogeneous != null) {
            options = options.withHeterogeneousNumericComparisons(parseBoolean(ENV_HETEROGENEOUS, heterogeneous));
        }
        String cacheSize = env(envLookup, ENV_CACHE_SIZE);
        if (cacheSize != null) {
            options = withCacheSize(options, parseInt(ENV_CACHE_SIZE, cacheSize), ENV_CACHE_SIZE);
        }
        String maxLength = env(envLookup, ENV_MAX_LENGTH);
        if (maxLength != null) {
            options = withMaxLength(options, parseInt(ENV_MAX_LENGTH, maxLength), ENV_MAX_LENGTH);
        }
        return options;
    }

    private static EvaluatorOptions fromYaml(JsonNode root) {
        EvaluatorOptions options = EvaluatorOptions.DEFAULT;
        JsonNode heterogeneous = root.path("numeric-comparisons").path("heterogeneous");
        if (!heterogeneous.isMissingNode()) {
            if (!heterogeneous.isBoolean()) {
                throw new OptionsLoadException(
                        "numeric-comparisons.heterogeneous must be a boolean, got: " + heterogeneous);
            }
            options = options.withHeterogeneousNumericComparisons(heterogeneous.booleanValue());
        }
        JsonNode cacheSize = root.path("program-cache").path("size");
        if (!cacheSize.isMissingNode()) {
            options = withCacheSize(options, requireInt("program-cache.size", cacheSize), "program-cache.size");
        }
        JsonNode maxLength = root.path("expression").path("max-length");
        if (!maxLength.isMissingNode()) {
            options = withMaxLength(options, requireInt("expression.max-length", maxLength), "expression.max-length");
        }
        return options;
    }

    private static EvaluatorOptions withCacheSize(EvaluatorOptions options, int size, String key) {
        try {
            return options.withProgramCacheSize(size);
        } catch (IllegalArgumentException e) {
            throw new OptionsLoadException("Invalid value for " + key + ": " + e.getMessage(), e);
        }
    }

    private static EvaluatorOptions withMaxLength(EvaluatorOptions options, int length, String key) {
        try {
            return options.withMaxExpressionLength(length);
        } catch (IllegalArgumentException e) {
            throw new OptionsLoadException("Invalid value for " + key + ": " + e.getMessage(), e);
        }
    }

    private static int requireInt(String key, JsonNode node) {
        if (!node.isInt()) {
            throw new OptionsLoadException(key + " must be an integer, got: " + node);
        }
        return node.intValue();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new OptionsLoadException(key + " must be an integer, got: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new OptionsLoadException(key + " must be 'true' or 'false', got: '" + value + "'");
    }

    /** Returns the trimmed env value, or {@code null} if undefined or blank. */
    private static String env(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
