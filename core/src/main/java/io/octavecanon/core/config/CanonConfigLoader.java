package io.octavecanon.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.octavecanon.core.schema.UnknownFieldPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;

/**
 * Loads {@link CanonConfig} from YAML with an environment variable overlay.
 *
 * <pre>
 * repair:
 *   apply: true
 * validation:
 *   unknown-fields: REJECT
 * input:
 *   max-chars: 1048576
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML: {@code CANON_REPAIR_APPLY},
 * {@code CANON_UNKNOWN_FIELDS}, {@code CANON_MAX_INPUT_CHARS}. A variable counts as set
 * only when it is defined and not blank. Missing keys keep the {@link CanonConfig}
 * defaults.
 */
public final class CanonConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_REPAIR_APPLY = "CANON_REPAIR_APPLY";
    static final String ENV_UNKNOWN_FIELDS = "CANON_UNKNOWN_FIELDS";
    static final String ENV_MAX_INPUT_CHARS = "CANON_MAX_INPUT_CHARS";

    private CanonConfigLoader() {
        // utility class
    }

    /** Loads {@code configPath} and overlays {@link System#getenv}. */
    public static CanonConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads {@code configPath} and overlays variables from {@code envLookup}, which
     * returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an
     *                             invalid value
     */
    public static CanonConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return fromTree(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
    }

    /** Builds a configuration from environment variables alone. */
    public static CanonConfig fromEnvironment(Function<String, String> envLookup) {
        return fromTree(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static CanonConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        CanonConfig.Builder builder = CanonConfig.builder();

        JsonNode repair = root.path("repair");
        if (repair.has("apply")) {
            builder.repairApply(bool(repair.get("apply").asText(), "repair.apply"));
        }
        JsonNode validation = root.path("validation");
        if (validation.has("unknown-fields")) {
            builder.unknownFieldsOverride(
                    policy(validation.get("unknown-fields").asText(), "validation.unknown-fields"));
        }
        JsonNode input = root.path("input");
        if (input.has("max-chars")) {
            builder.maxInputChars(nonNegativeInt(input.get("max-chars").asText(), "input.max-chars"));
        }

        if (isSet(envLookup, ENV_REPAIR_APPLY)) {
            builder.repairApply(bool(env(envLookup, ENV_REPAIR_APPLY), ENV_REPAIR_APPLY));
        }
        if (isSet(envLookup, ENV_UNKNOWN_FIELDS)) {
            builder.unknownFieldsOverride(policy(env(envLookup, ENV_UNKNOWN_FIELDS), ENV_UNKNOWN_FIELDS));
        }
        if (isSet(envLookup, ENV_MAX_INPUT_CHARS)) {
            builder.maxInputChars(nonNegativeInt(env(envLookup, ENV_MAX_INPUT_CHARS), ENV_MAX_INPUT_CHARS));
        }
        return builder.build();
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static String env(Function<String, String> envLookup, String envVar) {
        return envLookup.apply(envVar).trim();
    }

    private static boolean bool(String text, String key) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        if (lower.equals("true")) {
            return true;
        }
        if (lower.equals("false")) {
            return false;
        }
        throw new ConfigLoadException(key + " must be true or false, got '" + text + "'");
    }

    private static UnknownFieldPolicy policy(String text, String key) {
        String upper = text.trim().toUpperCase(Locale.ROOT);
        for (UnknownFieldPolicy policy : UnknownFieldPolicy.values()) {
            if (policy.name().equals(upper)) {
                return policy;
            }
        }
        throw new ConfigLoadException(key + " must be one of REJECT, WARN, IGNORE, got '" + text + "'");
    }

    private static int nonNegativeInt(String text, String key) {
        int value;
        try {
            value = Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(key + " must be an integer, got '" + text + "'", e);
        }
        if (value < 0) {
            throw new ConfigLoadException(key + " must be >= 0, got " + value);
        }
        return value;
    }
}
