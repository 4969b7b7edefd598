package org.neuralchilli.cellflow.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParserTest {

    private final ConfigParser parser = new ConfigParser();

    @TempDir
    Path tempDir;

    @Test
    void shouldParseFullConfiguration() {
        // Given
        String yaml = """
                input_path: raw
                output_path: /data/analysis
                file_pattern: "*.nd"
                alignment_enabled: true
                alignment_path: beads
                dual_pass_enabled: true
                selection: cyto
                other_segmentation_enabled: true
                other_segmentation_channels: [2]
                detect_channels: [0, 1]
                colocalization_enabled: true
                colocalization_channels:
                  - [0, 1]
                do_3d: false
                do_timeseries: true
                accelerator_enabled: true
                stage_commands:
                  detect:
                    - koopa
                    - --detect
                    - "${file}"
                  preprocess: koopa --preprocess ${file}
                """;

        // When
        PipelineConfig config = parser.parse(yaml, tempDir);

        // Then
        assertThat(config.inputPath()).isEqualTo(tempDir.resolve("raw").toAbsolutePath().normalize());
        assertThat(config.outputPath()).isEqualTo(Path.of("/data/analysis").toAbsolutePath());
        assertThat(config.filePattern()).isEqualTo("*.nd");
        assertThat(config.alignmentEnabled()).isTrue();
        assertThat(config.alignmentPath()).isEqualTo(tempDir.resolve("beads").toAbsolutePath().normalize());
        assertThat(config.dualPassSegmentation()).isTrue();
        assertThat(config.selection()).isEqualTo(SegmentationSelection.CYTO);
        assertThat(config.otherSegmentationChannels()).containsExactly(2);
        assertThat(config.detectChannels()).containsExactly(0, 1);
        assertThat(config.colocalizationChannels()).containsExactly(ChannelPair.of(0, 1));
        assertThat(config.timeSeries()).isTrue();
        assertThat(config.trackingEnabled()).isTrue();
        assertThat(config.acceleratorEnabled()).isTrue();
        assertThat(config.commandFor("detect")).containsExactly("koopa", "--detect", "${file}");
        assertThat(config.commandFor("preprocess")).containsExactly("koopa", "--preprocess", "${file}");
        assertThat(config.commandFor("track")).isEmpty();
    }

    @Test
    void shouldApplyDefaults() {
        // Given: Only the required paths
        String yaml = """
                input_path: /data/in
                output_path: /data/out
                """;

        // When
        PipelineConfig config = parser.parse(yaml, tempDir);

        // Then
        assertThat(config.filePattern()).isEqualTo("*.tif");
        assertThat(config.selection()).isEqualTo(SegmentationSelection.NUCLEI);
        assertThat(config.alignmentEnabled()).isFalse();
        assertThat(config.colocalizationEnabled()).isFalse();
        assertThat(config.detectChannels()).isEmpty();
        assertThat(config.trackingEnabled()).isFalse();
    }

    @Test
    void shouldResolveRelativePathsAgainstConfigFile() throws Exception {
        // Given
        Path configFile = tempDir.resolve("project/config.yaml");
        Files.createDirectories(configFile.getParent());
        Files.writeString(configFile, """
                input_path: images
                output_path: results
                """);

        // When
        PipelineConfig config = parser.parse(configFile);

        // Then
        assertThat(config.inputPath()).isEqualTo(tempDir.resolve("project/images").toAbsolutePath().normalize());
        assertThat(config.outputPath()).isEqualTo(tempDir.resolve("project/results").toAbsolutePath().normalize());
    }

    @Test
    void shouldRejectMissingRequiredField() {
        assertThatThrownBy(() -> parser.parse("input_path: /data/in\n", tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required field: output_path");
    }

    @Test
    void shouldRequireAlignmentPathWhenEnabled() {
        String yaml = """
                input_path: /data/in
                output_path: /data/out
                alignment_enabled: true
                """;

        assertThatThrownBy(() -> parser.parse(yaml, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required field: alignment_path");
    }

    @Test
    void shouldRejectMalformedColocalizationPair() {
        String yaml = """
                input_path: /data/in
                output_path: /data/out
                detect_channels: [0, 1]
                colocalization_enabled: true
                colocalization_channels:
                  - [0, 1, 2]
                """;

        assertThatThrownBy(() -> parser.parse(yaml, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[reference, transform]");
    }

    @Test
    void shouldRejectUnknownSelection() {
        String yaml = """
                input_path: /data/in
                output_path: /data/out
                selection: membranes
                """;

        assertThatThrownBy(() -> parser.parse(yaml, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("membranes");
    }

    @Test
    void shouldRejectNonIntegerChannel() {
        String yaml = """
                input_path: /data/in
                output_path: /data/out
                detect_channels: [0, green]
                """;

        assertThatThrownBy(() -> parser.parse(yaml, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("green");
    }

    @Test
    void shouldRejectFractionalAndOversizedChannels() {
        String fractional = """
                input_path: /data/in
                output_path: /data/out
                detect_channels: [0, 1.5]
                """;
        String oversized = """
                input_path: /data/in
                output_path: /data/out
                colocalization_enabled: true
                detect_channels: [0]
                colocalization_channels:
                  - [0, 4294967296]
                """;

        assertThatThrownBy(() -> parser.parse(fractional, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("detect_channels contains a non-integer value: 1.5");
        assertThatThrownBy(() -> parser.parse(oversized, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4294967296");
    }

    @Test
    void shouldRejectMisspelledBoolean() {
        String yaml = """
                input_path: /data/in
                output_path: /data/out
                do_3d: ture
                """;

        assertThatThrownBy(() -> parser.parse(yaml, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("do_3d must be true or false, got: ture");
    }

    @Test
    void shouldAcceptQuotedBoolean() {
        String yaml = """
                input_path: /data/in
                output_path: /data/out
                do_timeseries: "TRUE"
                """;

        assertThat(parser.parse(yaml, tempDir).timeSeries()).isTrue();
    }

    @Test
    void shouldRejectCommandForUnknownStage() {
        String yaml = """
                input_path: /data/in
                output_path: /data/out
                stage_commands:
                  deconvolve: [run.sh]
                """;

        assertThatThrownBy(() -> parser.parse(yaml, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown stage: deconvolve");
    }

    @Test
    void shouldRejectNonMappingDocument() {
        assertThatThrownBy(() -> parser.parse(List.of("a", "b").toString(), tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mapping");
    }
}
