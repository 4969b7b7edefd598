package org.neuralchilli.cellflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.cellflow.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the input files of a run.
 * <p>
 * Lists the regular files directly under the input directory whose name
 * matches the configured glob, sorted by name. A file's id is its name
 * without the extension.
 */
@ApplicationScoped
public class FileDiscovery {

    private static final Logger log = LoggerFactory.getLogger(FileDiscovery.class);

    /**
     * @return file ids in name order
     * @throws IOException              if the input directory cannot be listed
     * @throws IllegalArgumentException if two files share an id
     */
    public List<String> discover(PipelineConfig config) throws IOException {
        Path inputDir = config.inputPath();
        if (!Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("Input path is not a directory: " + inputDir);
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + config.filePattern());

        List<Path> files;
        try (Stream<Path> listing = Files.list(inputDir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> matcher.matches(path.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        }

        Map<String, Path> byId = new LinkedHashMap<>();
        for (Path file : files) {
            Path previous = byId.put(fileIdOf(file), file);
            if (previous != null) {
                throw new IllegalArgumentException(
                        "Files " + previous.getFileName() + " and " + file.getFileName() + " share the same id");
            }
        }

        log.info("Found {} files matching '{}' in {}", byId.size(), config.filePattern(), inputDir);
        return List.copyOf(byId.keySet());
    }

    static String fileIdOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
