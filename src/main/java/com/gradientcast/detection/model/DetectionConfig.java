package com.gradientcast.detection.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-level configuration: detector choice, global parameters and
 * per-dimension overrides. Unset global fields fall back to the built-in
 * defaults from {@code detection.defaults.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DetectionConfig {

    @Builder.Default
    private DetectorType detector = DetectorType.DENSE_AD;

    private Double contamination;
    @JsonProperty("n_neighbors")
    private Integer nNeighbors;
    private Double valleyThreshold;
    private Integer minContiguousAnomalies;
    private Double percentageThreshold;
    private Double minimumValueThreshold;
    private Frequency frequency;
    private Double returnWindowHours;
    private Integer validationPoints;

    @Builder.Default
    private Map<String, ConfigOverride> perDimensionOverrides = new LinkedHashMap<>();

    // dimension -> timestamp text -> expected value, used by PulseAD instead of the rolling mean
    @Builder.Default
    private Map<String, Map<String, Double>> externalBaselines = new LinkedHashMap<>();
}
