package org.neuralchilli.cellflow.domain;

import java.util.Arrays;

/**
 * The stages a pipeline run is composed of.
 * Each stage knows the directory its artifacts live in, the artifact kind it
 * produces, and whether it needs the accelerator.
 */
public enum StageName {

    ALIGN("align", "alignment", ArtifactKind.TABULAR, false),
    PREPROCESS("preprocess", "preprocessed", ArtifactKind.RASTER, false),
    SEGMENT_CELLS_SINGLE("segment-cells-single", "segmentation_cells", ArtifactKind.RASTER, false),
    SEGMENT_CELLS_BOTH("segment-cells-both", "segmentation_cells", ArtifactKind.RASTER, false),
    SEGMENT_CELLS_PREDICT("segment-cells-predict", "segmentation_cells_predict", ArtifactKind.RASTER, true),
    SEGMENT_CELLS_MERGE("segment-cells-merge", "segmentation_cells_merge", ArtifactKind.RASTER, false),
    DILATE_CELLS("dilate-cells", "segmentation_cells", ArtifactKind.RASTER, false),
    SEGMENT_OTHER("segment-other", "segmentation", ArtifactKind.RASTER, true),
    DETECT("detect", "detection_raw", ArtifactKind.TABULAR, true),
    TRACK("track", "detection_final", ArtifactKind.TABULAR, false),
    COLOCALIZE_FRAME("colocalize-frame", "colocalization", ArtifactKind.TABULAR, false),
    COLOCALIZE_TRACK("colocalize-track", "colocalization", ArtifactKind.TABULAR, false),
    MERGE_SINGLE("merge-single", "summary", ArtifactKind.TABULAR, false),
    MERGE_ALL("merge-all", "summary", ArtifactKind.TABULAR, false);

    private final String id;
    private final String directory;
    private final ArtifactKind kind;
    private final boolean acceleratorBound;

    StageName(String id, String directory, ArtifactKind kind, boolean acceleratorBound) {
        this.id = id;
        this.directory = directory;
        this.kind = kind;
        this.acceleratorBound = acceleratorBound;
    }

    /**
     * Stable identifier used in task names, logs and configuration keys.
     */
    public String id() {
        return id;
    }

    public String directory() {
        return directory;
    }

    public ArtifactKind kind() {
        return kind;
    }

    /**
     * Whether tasks of this stage run their work behind the resource gate
     * when accelerator use is enabled.
     */
    public boolean isAcceleratorBound() {
        return acceleratorBound;
    }

    public static StageName fromId(String id) {
        return Arrays.stream(values())
                .filter(stage -> stage.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + id));
    }

    /**
     * Kind of persisted artifact a stage writes.
     */
    public enum ArtifactKind {
        TABULAR(".csv"),
        RASTER(".tif");

        private final String extension;

        ArtifactKind(String extension) {
            this.extension = extension;
        }

        public String extension() {
            return extension;
        }
    }
}
