package org.neuralchilli.cellflow.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.cellflow.domain.Artifact;
import org.neuralchilli.cellflow.domain.RunReport;
import org.neuralchilli.cellflow.domain.StageName;
import org.neuralchilli.cellflow.domain.TaskStatus;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the wired pipeline end to end with stage commands in trial-run mode.
 */
@QuarkusTest
class PipelineServiceTest {

    @Inject
    PipelineService pipelineService;

    private Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        tempDir = Files.createTempDirectory("cellflow-run-");
    }

    @AfterEach
    void tearDown() throws Exception {
        try (Stream<Path> paths = Files.walk(tempDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(path);
            }
        }
    }

    private Path writeProject() throws Exception {
        Path input = tempDir.resolve("images");
        Files.createDirectories(input);
        Files.write(input.resolve("img01.tif"), new byte[0]);
        Files.write(input.resolve("img02.tif"), new byte[0]);
        Files.write(input.resolve("img03.tif"), new byte[0]);
        Files.writeString(input.resolve("README.txt"), "not an image");
        Files.createDirectories(tempDir.resolve("beads"));

        Path configFile = tempDir.resolve("config.yaml");
        Files.writeString(configFile, """
                input_path: images
                output_path: results
                alignment_enabled: true
                alignment_path: beads
                detect_channels: [0, 1]
                colocalization_enabled: true
                colocalization_channels:
                  - [0, 1]
                accelerator_enabled: true
                """);
        return configFile;
    }

    @Test
    void shouldRunWholePipelineAndWriteSummary() throws Exception {
        // Given
        Path configFile = writeProject();
        Path results = tempDir.resolve("results");

        // When
        RunReport report = pipelineService.run(configFile, false);

        // Then: Every file made it into the summary
        assertThat(report.succeededFiles()).containsExactly("img01", "img02", "img03");
        assertThat(report.countByStatus(TaskStatus.FAILED)).isZero();
        assertThat(report.execution("align").status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(Files.readAllLines(results.resolve("summary.csv"))).containsExactly(
                "FileID,stage,channel",
                "img01,merge-single,",
                "img02,merge-single,",
                "img03,merge-single,");

        // And: File-independent outputs and artifacts follow the layout
        assertThat(results.resolve("run_info.json")).exists();
        assertThat(results.resolve("alignment/align.csv")).exists();
        assertThat(results.resolve("detection_raw_c1/img02.csv")).exists();
        assertThat(results.resolve("colocalization_0-1/img03.csv")).exists();
    }

    @Test
    void shouldReuseArtifactsOnRerun() throws Exception {
        // Given: A completed run
        Path configFile = writeProject();
        RunReport first = pipelineService.run(configFile, false);
        byte[] summary = Files.readAllBytes(first.summary().path());

        // When
        RunReport second = pipelineService.run(configFile, false);

        // Then
        assertThat(second.cachedTasks()).isEqualTo(second.executions().size() - 1);
        assertThat(Files.readAllBytes(second.summary().path())).isEqualTo(summary);
    }

    @Test
    void shouldRunOneChannelAsBatch() throws Exception {
        // Given
        Path configFile = writeProject();

        // When
        List<Map<String, Artifact>> results = pipelineService.runBatch(configFile, StageName.DETECT, 1, false);

        // Then: One entry per discovered image, in file order
        assertThat(results).extracting(entry -> entry.get("detect_c1").path().getFileName().toString())
                .containsExactly("img01.csv", "img02.csv", "img03.csv");
        assertThat(tempDir.resolve("results/detection_raw_c1/img03.csv")).exists();
    }
}
