package org.neuralchilli.cellflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.cellflow.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes JVM and system information next to the results of a run.
 */
@ApplicationScoped
public class RunMetadataWriter {

    private static final Logger log = LoggerFactory.getLogger(RunMetadataWriter.class);

    static final String METADATA_FILE = "run_info.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public Path write(PipelineConfig config, Path configFile) throws IOException {
        Runtime runtime = Runtime.getRuntime();

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("started_at", Instant.now().toString());
        info.put("config_file", configFile.toAbsolutePath().toString());
        info.put("input_path", config.inputPath().toString());
        info.put("java_version", System.getProperty("java.version"));
        info.put("java_vendor", System.getProperty("java.vendor"));
        info.put("os_name", System.getProperty("os.name"));
        info.put("os_arch", System.getProperty("os.arch"));
        info.put("os_version", System.getProperty("os.version"));
        info.put("available_processors", runtime.availableProcessors());
        info.put("max_memory_bytes", runtime.maxMemory());

        Files.createDirectories(config.outputPath());
        Path target = config.outputPath().resolve(METADATA_FILE);
        objectMapper.writeValue(target.toFile(), info);

        log.debug("Run metadata written to {}", target);
        return target;
    }
}
