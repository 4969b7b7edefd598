package org.neuralchilli.cellflow.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.cellflow.domain.StageName;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses a pipeline configuration YAML file into a {@link PipelineConfig}.
 * <p>
 * Relative paths are resolved against the directory of the configuration
 * file. Colocalization pairs are written as two-element lists:
 * <pre>
 * colocalization_channels:
 *   - [0, 1]
 * </pre>
 */
@ApplicationScoped
public class ConfigParser {

    private final Yaml yaml = new Yaml();

    /**
     * Parse a configuration file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the content is invalid
     */
    public PipelineConfig parse(Path configFile) throws IOException {
        try (InputStream in = Files.newInputStream(configFile)) {
            Path baseDir = configFile.toAbsolutePath().getParent();
            return parseFromMap(load(yaml.load(in)), baseDir);
        }
    }

    /**
     * Parse configuration from a YAML string; relative paths resolve against
     * {@code baseDir}.
     */
    public PipelineConfig parse(String yamlContent, Path baseDir) {
        return parseFromMap(load(yaml.load(yamlContent)), baseDir);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> load(Object document) {
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Configuration must be a YAML mapping");
        }
        return (Map<String, Object>) document;
    }

    private PipelineConfig parseFromMap(Map<String, Object> data, Path baseDir) {
        Path inputPath = getPath(data, "input_path", baseDir, true);
        Path outputPath = getPath(data, "output_path", baseDir, true);

        boolean alignmentEnabled = getBoolean(data, "alignment_enabled", false);
        Path alignmentPath = getPath(data, "alignment_path", baseDir, alignmentEnabled);

        String selection = getString(data, "selection", false);

        return new PipelineConfig(
                inputPath,
                outputPath,
                getString(data, "file_pattern", false),
                alignmentEnabled,
                alignmentPath,
                getBoolean(data, "dual_pass_enabled", false),
                selection != null ? SegmentationSelection.fromString(selection) : null,
                getBoolean(data, "other_segmentation_enabled", false),
                getIntList(data, "other_segmentation_channels"),
                getIntList(data, "detect_channels"),
                getBoolean(data, "colocalization_enabled", false),
                getPairs(data, "colocalization_channels"),
                getBoolean(data, "do_3d", false),
                getBoolean(data, "do_timeseries", false),
                getBoolean(data, "accelerator_enabled", false),
                getCommands(data, "stage_commands")
        );
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private Path getPath(Map<String, Object> map, String key, Path baseDir, boolean required) {
        String value = getString(map, key, required);
        if (value == null) {
            return null;
        }
        Path path = Path.of(value);
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path);
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false, got: " + value);
    }

    private List<Integer> getIntList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(key + " must be a list of channel indices");
        }
        return ((List<?>) value).stream()
                .map(item -> toInt(key, item))
                .collect(Collectors.toList());
    }

    private List<ChannelPair> getPairs(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(key + " must be a list of [reference, transform] pairs");
        }

        List<ChannelPair> pairs = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof List) || ((List<?>) item).size() != 2) {
                throw new IllegalArgumentException(
                        key + " entries must be [reference, transform] pairs, got: " + item);
            }
            List<?> pair = (List<?>) item;
            pairs.add(ChannelPair.of(toInt(key, pair.get(0)), toInt(key, pair.get(1))));
        }
        return pairs;
    }

    private Map<String, List<String>> getCommands(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(key + " must map stage ids to commands");
        }

        Map<String, List<String>> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((stage, command) -> {
            String stageId = StageName.fromId(String.valueOf(stage)).id();
            if (command instanceof List) {
                result.put(stageId, ((List<?>) command).stream()
                        .map(Object::toString)
                        .collect(Collectors.toList()));
            } else if (command != null) {
                result.put(stageId, List.of(command.toString().trim().split("\\s+")));
            }
        });
        return result;
    }

    private static int toInt(String key, Object value) {
        // Fractions and out-of-range values fail the exact parse
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " contains a non-integer value: " + value, e);
        }
    }
}
