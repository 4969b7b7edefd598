package org.neuralchilli.cellflow.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageNameTest {

    @Test
    void shouldResolveStageById() {
        assertThat(StageName.fromId("colocalize-track")).isEqualTo(StageName.COLOCALIZE_TRACK);
        assertThat(StageName.fromId("merge-all").kind()).isEqualTo(StageName.ArtifactKind.TABULAR);
    }

    @Test
    void shouldRejectUnknownId() {
        assertThatThrownBy(() -> StageName.fromId("deconvolve"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deconvolve");
    }

    @Test
    void shouldMarkOnlyModelStagesAsAcceleratorBound() {
        assertThat(StageName.DETECT.isAcceleratorBound()).isTrue();
        assertThat(StageName.SEGMENT_OTHER.isAcceleratorBound()).isTrue();
        assertThat(StageName.SEGMENT_CELLS_PREDICT.isAcceleratorBound()).isTrue();
        assertThat(StageName.TRACK.isAcceleratorBound()).isFalse();
        assertThat(StageName.MERGE_SINGLE.isAcceleratorBound()).isFalse();
    }
}
