package org.neuralchilli.cellflow.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.cellflow.config.PipelineConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileDiscoveryTest {

    private final FileDiscovery discovery = new FileDiscovery();

    @TempDir
    Path tempDir;

    private PipelineConfig config(String pattern) {
        return PipelineConfig.builder(tempDir.resolve("in"), tempDir.resolve("out"))
                .filePattern(pattern)
                .build();
    }

    private void create(String... names) throws Exception {
        Path input = tempDir.resolve("in");
        Files.createDirectories(input);
        for (String name : names) {
            Files.write(input.resolve(name), new byte[0]);
        }
    }

    @Test
    void shouldListMatchingFilesSortedByName() throws Exception {
        // Given
        create("img10.tif", "img02.tif", "notes.txt", "img01.tif");
        Files.createDirectories(tempDir.resolve("in/nested.tif"));

        // When
        List<String> fileIds = discovery.discover(config("*.tif"));

        // Then
        assertThat(fileIds).containsExactly("img01", "img02", "img10");
    }

    @Test
    void shouldHonorCustomPattern() throws Exception {
        create("a.nd", "b.nd", "c.tif");

        assertThat(discovery.discover(config("*.nd"))).containsExactly("a", "b");
    }

    @Test
    void shouldRejectFilesSharingAnId() throws Exception {
        create("img01.tif", "img01.tiff");

        assertThatThrownBy(() -> discovery.discover(config("*.tif*")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same id");
    }

    @Test
    void shouldRejectMissingInputDirectory() {
        assertThatThrownBy(() -> discovery.discover(config("*.tif")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a directory");
    }

    @Test
    void shouldStripOnlyLastExtension() {
        assertThat(FileDiscovery.fileIdOf(Path.of("sample.ome.tif"))).isEqualTo("sample.ome");
        assertThat(FileDiscovery.fileIdOf(Path.of(".hidden"))).isEqualTo(".hidden");
    }
}
