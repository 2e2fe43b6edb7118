package com.gradientcast.detection.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial parameter set for one dimension. A null field falls through to the
 * global request config, then to the built-in defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConfigOverride {

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
}
