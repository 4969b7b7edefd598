package org.neuralchilli.cellflow.config;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolved configuration of one pipeline run.
 * Loaded once per run and never mutated afterwards; every task of the run
 * receives the same instance.
 */
public record PipelineConfig(
        Path inputPath,
        Path outputPath,
        String filePattern,
        boolean alignmentEnabled,
        Path alignmentPath,
        boolean dualPassSegmentation,
        SegmentationSelection selection,
        boolean otherSegmentationEnabled,
        List<Integer> otherSegmentationChannels,
        List<Integer> detectChannels,
        boolean colocalizationEnabled,
        List<ChannelPair> colocalizationChannels,
        boolean do3d,
        boolean timeSeries,
        boolean acceleratorEnabled,
        Map<String, List<String>> stageCommands
) {
    public PipelineConfig {
        if (inputPath == null) {
            throw new IllegalArgumentException("Input path cannot be null");
        }
        if (outputPath == null) {
            throw new IllegalArgumentException("Output path cannot be null");
        }
        if (alignmentEnabled && alignmentPath == null) {
            throw new IllegalArgumentException("Alignment is enabled but no alignment path is set");
        }

        // Defaults
        if (filePattern == null || filePattern.isBlank()) {
            filePattern = "*.tif";
        }
        if (selection == null) {
            selection = SegmentationSelection.NUCLEI;
        }
        otherSegmentationChannels = otherSegmentationChannels != null
                ? List.copyOf(otherSegmentationChannels) : List.of();
        detectChannels = detectChannels != null ? List.copyOf(detectChannels) : List.of();
        colocalizationChannels = colocalizationChannels != null
                ? List.copyOf(colocalizationChannels) : List.of();
        stageCommands = stageCommands != null ? Map.copyOf(stageCommands) : Map.of();

        inputPath = inputPath.toAbsolutePath().normalize();
        outputPath = outputPath.toAbsolutePath().normalize();
        if (alignmentPath != null) {
            alignmentPath = alignmentPath.toAbsolutePath().normalize();
        }

        requireDistinct("detect_channels", detectChannels);
        requireDistinct("other_segmentation_channels", otherSegmentationChannels);

        if (colocalizationEnabled) {
            for (ChannelPair pair : colocalizationChannels) {
                if (!detectChannels.contains(pair.reference()) || !detectChannels.contains(pair.transform())) {
                    throw new IllegalArgumentException(
                            "Colocalization pair " + pair + " uses a channel that is not in detect_channels "
                                    + detectChannels
                    );
                }
            }
            if (new HashSet<>(colocalizationChannels).size() != colocalizationChannels.size()) {
                throw new IllegalArgumentException("Duplicate colocalization pairs: " + colocalizationChannels);
            }
        }
    }

    private static void requireDistinct(String field, List<Integer> channels) {
        Set<Integer> seen = new HashSet<>();
        for (Integer channel : channels) {
            if (channel == null || channel < 0) {
                throw new IllegalArgumentException(field + " must contain non-negative channel indices");
            }
            if (!seen.add(channel)) {
                throw new IllegalArgumentException(field + " contains channel " + channel + " twice");
            }
        }
    }

    /**
     * Tracking runs for 3D stacks and for time series.
     */
    public boolean trackingEnabled() {
        return do3d || timeSeries;
    }

    public List<String> commandFor(String stageId) {
        return stageCommands.getOrDefault(stageId, List.of());
    }

    public static Builder builder(Path inputPath, Path outputPath) {
        return new Builder(inputPath, outputPath);
    }

    public static class Builder {
        private final Path inputPath;
        private final Path outputPath;
        private String filePattern = "*.tif";
        private boolean alignmentEnabled = false;
        private Path alignmentPath;
        private boolean dualPassSegmentation = false;
        private SegmentationSelection selection = SegmentationSelection.NUCLEI;
        private boolean otherSegmentationEnabled = false;
        private List<Integer> otherSegmentationChannels = List.of();
        private List<Integer> detectChannels = List.of();
        private boolean colocalizationEnabled = false;
        private List<ChannelPair> colocalizationChannels = List.of();
        private boolean do3d = false;
        private boolean timeSeries = false;
        private boolean acceleratorEnabled = false;
        private Map<String, List<String>> stageCommands = Map.of();

        public Builder(Path inputPath, Path outputPath) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
        }

        public Builder filePattern(String filePattern) {
            this.filePattern = filePattern;
            return this;
        }

        public Builder alignment(Path alignmentPath) {
            this.alignmentEnabled = alignmentPath != null;
            this.alignmentPath = alignmentPath;
            return this;
        }

        public Builder dualPassSegmentation(boolean dualPassSegmentation) {
            this.dualPassSegmentation = dualPassSegmentation;
            return this;
        }

        public Builder selection(SegmentationSelection selection) {
            this.selection = selection;
            return this;
        }

        public Builder otherSegmentation(List<Integer> channels) {
            this.otherSegmentationEnabled = channels != null && !channels.isEmpty();
            this.otherSegmentationChannels = channels;
            return this;
        }

        public Builder detectChannels(List<Integer> detectChannels) {
            this.detectChannels = detectChannels;
            return this;
        }

        public Builder colocalization(List<ChannelPair> pairs) {
            this.colocalizationEnabled = pairs != null && !pairs.isEmpty();
            this.colocalizationChannels = pairs;
            return this;
        }

        public Builder do3d(boolean do3d) {
            this.do3d = do3d;
            return this;
        }

        public Builder timeSeries(boolean timeSeries) {
            this.timeSeries = timeSeries;
            return this;
        }

        public Builder acceleratorEnabled(boolean acceleratorEnabled) {
            this.acceleratorEnabled = acceleratorEnabled;
            return this;
        }

        public Builder stageCommands(Map<String, List<String>> stageCommands) {
            this.stageCommands = stageCommands;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(
                    inputPath, outputPath, filePattern,
                    alignmentEnabled, alignmentPath,
                    dualPassSegmentation, selection,
                    otherSegmentationEnabled, otherSegmentationChannels,
                    detectChannels,
                    colocalizationEnabled, colocalizationChannels,
                    do3d, timeSeries, acceleratorEnabled,
                    stageCommands
            );
        }
    }
}
