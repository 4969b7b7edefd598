package org.neuralchilli.cellflow.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.cellflow.config.ChannelPair;
import org.neuralchilli.cellflow.config.PipelineConfig;
import org.neuralchilli.cellflow.domain.CacheExcluded;
import org.neuralchilli.cellflow.domain.CacheKey;
import org.neuralchilli.cellflow.domain.LoadedModel;
import org.neuralchilli.cellflow.domain.StageArguments;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeyGeneratorTest {

    private final CacheKeyGenerator generator = new CacheKeyGenerator();

    @TempDir
    Path tempDir;

    @Test
    void shouldIgnoreGateAndModelWhenHashing() {
        // Given: Two invocations differing only in gate and model instances
        PipelineConfig config = TestGraphs.config(tempDir).detectChannels(List.of(0, 1)).build();
        LoadedModel modelA = () -> Path.of("model-a.h5");
        LoadedModel modelB = () -> Path.of("model-b.h5");

        StageArguments.Channel first = new StageArguments.Channel(
                "img01", config.outputPath(), config, 1, ResourceGate.exclusive("gpu-1"), modelA);
        StageArguments.Channel second = new StageArguments.Channel(
                "img01", config.outputPath(), config, 1, new ResourceGate("gpu-2", 3), modelB);

        // When/Then: Keys are identical
        assertThat(generator.keyFor(first)).isEqualTo(generator.keyFor(second));
    }

    @Test
    void shouldChangeKeyWhenIdentityArgumentChanges() {
        // Given: Same file, different channels
        PipelineConfig config = TestGraphs.config(tempDir).detectChannels(List.of(0, 1)).build();
        StageArguments.Channel channel0 = new StageArguments.Channel(
                "img01", config.outputPath(), config, 0, null, null);
        StageArguments.Channel channel1 = new StageArguments.Channel(
                "img01", config.outputPath(), config, 1, null, null);

        // Then
        assertThat(generator.keyFor(channel0)).isNotEqualTo(generator.keyFor(channel1));
    }

    @Test
    void shouldChangeKeyWhenConfigurationChanges() {
        // Given: Same arguments under two configurations
        PipelineConfig plain = TestGraphs.config(tempDir).detectChannels(List.of(0, 1)).build();
        PipelineConfig coloc = TestGraphs.config(tempDir)
                .detectChannels(List.of(0, 1))
                .colocalization(List.of(ChannelPair.of(0, 1)))
                .build();

        // Then
        assertThat(generator.keyFor(StageArguments.File.of("img01", plain)))
                .isNotEqualTo(generator.keyFor(StageArguments.File.of("img01", coloc)));
    }

    @Test
    void shouldBeDeterministicAcrossCalls() {
        // Given
        PipelineConfig config = TestGraphs.config(tempDir).build();
        StageArguments.File arguments = StageArguments.File.of("img01", config);

        // When
        CacheKey first = generator.keyFor(arguments);
        CacheKey second = new CacheKeyGenerator().keyFor(StageArguments.File.of("img01", config));

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first.hex()).hasSize(64);
    }

    @Test
    void shouldIgnoreMapOrderAndExcludedValues() {
        // Given: Same identity entries in different orders, one with a gate
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("file", "img01");
        first.put("channel", 2);
        first.put("gate", ResourceGate.exclusive("gpu"));

        Map<String, Object> second = new LinkedHashMap<>();
        second.put("channel", 2);
        second.put("file", "img01");

        // Then
        assertThat(generator.keyFor(first)).isEqualTo(generator.keyFor(second));
    }

    @Test
    void shouldReturnEmptyKeyWhenEverythingIsExcluded() {
        // Given
        Map<String, Object> arguments = Map.of("gate", ResourceGate.exclusive("gpu"));

        // Then
        assertThat(generator.keyFor(arguments).isEmpty()).isTrue();
    }

    @Test
    void shouldRejectUnmarkedGateComponent() {
        // Given: A record carrying a gate without the annotation
        PipelineConfig config = TestGraphs.config(tempDir).build();

        // Then
        assertThatThrownBy(() -> generator.keyForRecord(new UnmarkedArguments(
                config.outputPath(), config, ResourceGate.exclusive("gpu"))))
                .isInstanceOf(InvalidTaskException.class)
                .hasMessageContaining("gate")
                .hasMessageContaining("@CacheExcluded");
    }

    @Test
    void shouldReturnEmptyKeyForRecordWithOnlyExcludedComponents() {
        // Given
        GateOnlyArguments arguments = new GateOnlyArguments(ResourceGate.exclusive("gpu"));

        // Then
        assertThat(generator.keyForRecord(arguments)).isEqualTo(CacheKey.EMPTY);
    }

    @Test
    void shouldRecognizeExcludedTypes() {
        assertThat(generator.isExcludedType(ResourceGate.class)).isTrue();
        assertThat(generator.isExcludedType(LoadedModel.class)).isTrue();
        assertThat(generator.isExcludedType(String.class)).isFalse();
    }

    /**
     * Mirrors a sealed argument record but forgets {@link CacheExcluded}.
     */
    record UnmarkedArguments(Path outputDir, PipelineConfig config, ResourceGate gate) {
    }

    record GateOnlyArguments(@CacheExcluded ResourceGate gate) {
    }
}
