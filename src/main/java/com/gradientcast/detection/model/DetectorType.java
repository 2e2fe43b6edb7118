package com.gradientcast.detection.model;

/**
 * The detectors a caller can select. Only the density path runs the
 * valley/contiguity/severity post-processing pipeline.
 */
public enum DetectorType {
    DENSE_AD(true),
    PULSE_AD(false);

    private final boolean postProcessed;

    DetectorType(boolean postProcessed) {
        this.postProcessed = postProcessed;
    }

    public boolean isPostProcessed() {
        return postProcessed;
    }
}
