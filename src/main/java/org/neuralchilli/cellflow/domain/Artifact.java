package org.neuralchilli.cellflow.domain;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Handle to a persisted stage result.
 * Tasks exchange artifacts by path, never by in-memory value.
 */
public record Artifact(
        StageName stage,
        Path path
) {
    public Artifact {
        if (stage == null) {
            throw new IllegalArgumentException("Artifact stage cannot be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("Artifact path cannot be null");
        }
    }

    public static Artifact of(StageName stage, Path path) {
        return new Artifact(stage, path);
    }

    public boolean isTabular() {
        return stage.kind() == StageName.ArtifactKind.TABULAR;
    }

    @Nonnull
    @Override
    public String toString() {
        return "Artifact[" + stage.id() + " -> " + path + "]";
    }
}
