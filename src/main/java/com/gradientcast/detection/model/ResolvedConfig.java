package com.gradientcast.detection.model;

import lombok.Builder;
import lombok.Value;

/**
 * Flattened, validated parameter set for one dimension. Built once per
 * dimension by the config resolver and never mutated afterwards.
 */
@Value
@Builder
public class ResolvedConfig {
    String dimensionKey;
    DetectorType detector;

    // DenseAD
    double contamination;
    int nNeighbors;
    double valleyThreshold;
    int minContiguousAnomalies;

    // PulseAD
    double percentageThreshold;
    double minimumValueThreshold;

    Frequency frequency;

    // evaluation range; both null means the latest point only
    Double returnWindowHours;
    Integer validationPoints;
}
