package org.neuralchilli.cellflow.config;

/**
 * Which compartment single-pass cell segmentation targets.
 */
public enum SegmentationSelection {
    NUCLEI,
    CYTO,
    BOTH;

    public static SegmentationSelection fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Segmentation selection cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown segmentation selection: " + value + " (expected nuclei, cyto or both)", e
            );
        }
    }
}
