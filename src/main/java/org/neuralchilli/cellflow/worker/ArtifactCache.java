package org.neuralchilli.cellflow.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.cellflow.domain.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Cross-run result reuse.
 * <p>
 * When a task succeeds, a small JSON sidecar next to its artifact records the
 * task's cache key. A later run may skip the task if the artifact is still
 * there and the sidecar holds the same key.
 */
@ApplicationScoped
public class ArtifactCache {

    private static final Logger log = LoggerFactory.getLogger(ArtifactCache.class);

    static final String SIDECAR_SUFFIX = ".cache.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Whether the task's artifact from an earlier run can be reused.
     * An unreadable sidecar counts as a miss.
     */
    public boolean isReusable(TaskNode task) {
        Path output = task.output();
        Path sidecar = sidecarOf(output);
        if (!Files.exists(output) || !Files.exists(sidecar)) {
            return false;
        }

        try {
            Entry entry = objectMapper.readValue(sidecar.toFile(), Entry.class);
            boolean hit = task.cacheKey().hex().equals(entry.cacheKey())
                    && task.stage().id().equals(entry.stage());
            log.debug("Cache {} for {} (key {})", hit ? "hit" : "stale", task.name(), task.cacheKey().shortForm());
            return hit;
        } catch (IOException e) {
            log.warn("Unreadable cache sidecar {}, recomputing: {}", sidecar, e.getMessage());
            return false;
        }
    }

    /**
     * Record a successful task so later runs can reuse its artifact.
     */
    public void record(TaskNode task) throws IOException {
        Entry entry = new Entry(
                task.name(),
                task.stage().id(),
                task.cacheKey().hex(),
                Instant.now().toString()
        );
        objectMapper.writeValue(sidecarOf(task.output()).toFile(), entry);
    }

    /**
     * Drop the record of a task, e.g. before recomputing it.
     */
    public void invalidate(TaskNode task) throws IOException {
        Files.deleteIfExists(sidecarOf(task.output()));
    }

    static Path sidecarOf(Path artifact) {
        return artifact.resolveSibling(artifact.getFileName() + SIDECAR_SUFFIX);
    }

    /**
     * Sidecar content.
     */
    public record Entry(
            String task,
            String stage,
            String cacheKey,
            String recordedAt
    ) {
    }
}
