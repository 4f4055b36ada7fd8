package ai.dualpdf.translator.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A {@code config.json} file with snake_case keys. Empty strings count as unset so that an environment
 * variable can fill them in.
 */
public final class ConfigFile {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ConfigFile EMPTY = new ConfigFile(MissingNode.getInstance(), null);

    private final JsonNode root;
    private final Path source;

    private ConfigFile(JsonNode root, Path source) {
        this.root = root;
        this.source = source;
    }

    public static ConfigFile empty() {
        return EMPTY;
    }

    public static ConfigFile load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        try {
            JsonNode node = MAPPER.readTree(path.toFile());
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Configuration file must contain a JSON object: " + path);
            }
            return new ConfigFile(node, path);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Failed to read configuration file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    public Optional<String> string(String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Optional<Boolean> bool(String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isBoolean()) {
            return Optional.of(value.booleanValue());
        }
        return string(key).map(ConfigFile::parseBoolean);
    }

    public Optional<Long> number(String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isIntegralNumber()) {
            return Optional.of(value.longValue());
        }
        return string(key).map(raw -> parseLong(key, raw));
    }

    public Optional<Double> decimal(String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.doubleValue());
        }
        return string(key).map(raw -> parseDouble(key, raw));
    }

    public Optional<List<String>> stringList(String key) {
        JsonNode value = root.get(key);
        if (value == null || !value.isArray()) {
            return Optional.empty();
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (item.isTextual() && !item.asText().isBlank()) {
                items.add(item.asText());
            }
        }
        return Optional.of(List.copyOf(items));
    }

    static boolean parseBoolean(String raw) {
        String value = raw.trim();
        return value.equalsIgnoreCase("true") || value.equals("1") || value.equalsIgnoreCase("yes");
    }

    private static long parseLong(String key, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number", ex);
        }
    }
}
