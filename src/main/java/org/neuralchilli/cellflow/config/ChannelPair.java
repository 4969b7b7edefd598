package org.neuralchilli.cellflow.config;

import javax.annotation.Nonnull;

/**
 * A (reference, transform) channel pair to colocalize.
 */
public record ChannelPair(int reference, int transform) {

    public ChannelPair {
        if (reference < 0 || transform < 0) {
            throw new IllegalArgumentException(
                    "Channel indices cannot be negative, got: " + reference + "-" + transform
            );
        }
    }

    public static ChannelPair of(int reference, int transform) {
        return new ChannelPair(reference, transform);
    }

    /**
     * Label used in task names and artifact directories, e.g. {@code 0-1}.
     */
    public String label() {
        return reference + "-" + transform;
    }

    @Nonnull
    @Override
    public String toString() {
        return label();
    }
}
