package org.neuralchilli.cellflow.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.cellflow.domain.Artifact;
import org.neuralchilli.cellflow.domain.StageName;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    @TempDir
    Path tempDir;

    @Test
    void shouldConcatenateRowsUnderOneHeader() throws Exception {
        // Given: Two per-file summaries
        Artifact first = TestGraphs.csv(tempDir.resolve("summary/a.csv"),
                List.of("FileID,cells", "a,12", "a,3"));
        Artifact second = TestGraphs.csv(tempDir.resolve("summary/b.csv"),
                List.of("FileID,cells", "b,7", ""));
        Path target = tempDir.resolve("summary.csv");

        // When
        aggregator.aggregate(List.of(first, second), target);

        // Then
        assertThat(Files.readAllLines(target)).containsExactly("FileID,cells", "a,12", "a,3", "b,7");
        assertThat(target.resolveSibling("summary.csv.partial")).doesNotExist();
    }

    @Test
    void shouldWriteIdenticalBytesOnRerun() throws Exception {
        // Given
        Artifact first = TestGraphs.csv(tempDir.resolve("summary/a.csv"), List.of("FileID,x", "a,1"));
        Artifact second = TestGraphs.csv(tempDir.resolve("summary/b.csv"), List.of("FileID,x", "b,2"));
        Path target = tempDir.resolve("summary.csv");

        // When
        aggregator.aggregate(List.of(first, second), target);
        byte[] initial = Files.readAllBytes(target);
        aggregator.aggregate(List.of(first, second), target);

        // Then
        assertThat(Files.readAllBytes(target)).isEqualTo(initial);
    }

    @Test
    void shouldSkipEmptyInputs() throws Exception {
        // Given
        Artifact empty = TestGraphs.csv(tempDir.resolve("summary/a.csv"), List.of());
        Artifact full = TestGraphs.csv(tempDir.resolve("summary/b.csv"), List.of("FileID,x", "b,2"));
        Path target = tempDir.resolve("summary.csv");

        // When
        aggregator.aggregate(List.of(empty, full), target);

        // Then
        assertThat(Files.readAllLines(target)).containsExactly("FileID,x", "b,2");
    }

    @Test
    void shouldRejectMismatchedHeaders() throws Exception {
        // Given
        Artifact first = TestGraphs.csv(tempDir.resolve("summary/a.csv"), List.of("FileID,x", "a,1"));
        Artifact second = TestGraphs.csv(tempDir.resolve("summary/b.csv"), List.of("FileID,y", "b,2"));
        Path target = tempDir.resolve("summary.csv");

        // Then
        assertThatThrownBy(() -> aggregator.aggregate(List.of(first, second), target))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not match");
        assertThat(target).doesNotExist();
        assertThat(target.resolveSibling("summary.csv.partial")).doesNotExist();
    }

    @Test
    void shouldRejectRasterInput() throws Exception {
        // Given
        Path mask = tempDir.resolve("segmentation_cells/a.tif");
        Files.createDirectories(mask.getParent());
        Files.write(mask, new byte[0]);

        // Then
        assertThatThrownBy(() -> aggregator.aggregate(
                List.of(Artifact.of(StageName.DILATE_CELLS, mask)), tempDir.resolve("summary.csv")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("non-tabular");
    }
}
