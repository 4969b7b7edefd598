package org.neuralchilli.cellflow.domain;

import org.neuralchilli.cellflow.config.ChannelPair;
import org.neuralchilli.cellflow.config.PipelineConfig;
import org.neuralchilli.cellflow.core.ResourceGate;

import java.nio.file.Path;
import java.util.List;

/**
 * Concrete arguments of one stage invocation.
 * One record per argument shape, so every stage receives exactly the
 * parameters it recognizes. Components annotated with {@link CacheExcluded}
 * are left out of the cache key.
 */
public sealed interface StageArguments {

    /**
     * Root output directory of the run.
     */
    Path outputDir();

    PipelineConfig config();

    /**
     * Gate guarding the accelerator, or null when the task runs unrestricted.
     */
    default ResourceGate gate() {
        return null;
    }

    /**
     * Per-file stages without a channel selector: preprocessing, cell
     * segmentation and the per-file merge.
     */
    record File(
            String fileId,
            Path outputDir,
            PipelineConfig config,
            @CacheExcluded ResourceGate gate
    ) implements StageArguments {
        public File {
            requireFileId(fileId);
            requireCommon(outputDir, config);
        }

        public static File of(String fileId, PipelineConfig config) {
            return new File(fileId, config.outputPath(), config, null);
        }
    }

    /**
     * Per-file, per-channel stages: other segmentation, detection, tracking.
     */
    record Channel(
            String fileId,
            Path outputDir,
            PipelineConfig config,
            int channel,
            @CacheExcluded ResourceGate gate,
            @CacheExcluded LoadedModel model
    ) implements StageArguments {
        public Channel {
            requireFileId(fileId);
            requireCommon(outputDir, config);
            if (channel < 0) {
                throw new IllegalArgumentException("Channel cannot be negative: " + channel);
            }
        }
    }

    /**
     * Colocalization of one channel pair within one file.
     */
    record Pair(
            String fileId,
            Path outputDir,
            PipelineConfig config,
            ChannelPair pair
    ) implements StageArguments {
        public Pair {
            requireFileId(fileId);
            requireCommon(outputDir, config);
            if (pair == null) {
                throw new IllegalArgumentException("Channel pair cannot be null");
            }
        }
    }

    /**
     * File-independent alignment run before any file is processed.
     */
    record Alignment(
            Path alignmentPath,
            Path outputDir,
            PipelineConfig config
    ) implements StageArguments {
        public Alignment {
            if (alignmentPath == null) {
                throw new IllegalArgumentException("Alignment path cannot be null");
            }
            requireCommon(outputDir, config);
        }
    }

    /**
     * Run-level merge over the per-file results.
     */
    record Summary(
            Path outputDir,
            PipelineConfig config,
            List<String> fileIds
    ) implements StageArguments {
        public Summary {
            requireCommon(outputDir, config);
            fileIds = fileIds != null ? List.copyOf(fileIds) : List.of();
        }
    }

    private static void requireFileId(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("File id cannot be null or empty");
        }
    }

    private static void requireCommon(Path outputDir, PipelineConfig config) {
        if (outputDir == null) {
            throw new IllegalArgumentException("Output directory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
    }
}
