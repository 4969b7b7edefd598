package org.neuralchilli.cellflow.core;

import org.neuralchilli.cellflow.config.ChannelPair;
import org.neuralchilli.cellflow.domain.StageName;

import java.nio.file.Path;

/**
 * Deterministic location of every artifact a run produces.
 * <pre>
 *   out/preprocessed/img01.tif
 *   out/detection_raw_c1/img01.csv
 *   out/colocalization_0-1/img01.csv
 *   out/summary/img01.csv
 *   out/summary.csv
 * </pre>
 * Downstream tasks and later runs find results by these paths alone.
 */
public final class ArtifactLayout {

    public static final String SUMMARY_FILE = "summary.csv";

    private ArtifactLayout() {
    }

    public static Path forFile(Path outputDir, StageName stage, String fileId) {
        return outputDir.resolve(stage.directory()).resolve(fileId + stage.kind().extension());
    }

    public static Path forChannel(Path outputDir, StageName stage, int channel, String fileId) {
        return outputDir.resolve(stage.directory() + "_c" + channel)
                .resolve(fileId + stage.kind().extension());
    }

    public static Path forPair(Path outputDir, StageName stage, ChannelPair pair, String fileId) {
        return outputDir.resolve(stage.directory() + "_" + pair.label())
                .resolve(fileId + stage.kind().extension());
    }

    /**
     * Output of a file-independent stage such as alignment.
     */
    public static Path forRun(Path outputDir, StageName stage) {
        if (stage == StageName.MERGE_ALL) {
            return outputDir.resolve(SUMMARY_FILE);
        }
        return outputDir.resolve(stage.directory()).resolve(stage.id() + stage.kind().extension());
    }
}
