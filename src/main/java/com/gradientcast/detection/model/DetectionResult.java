package com.gradientcast.detection.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome for one dimension. Anomalies are chronological; alert severity is the
 * highest severity among them and absent when there are none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DetectionResult {

    private String dimensionKey;

    private DetectorType detector;

    // Sampling frequency the series was evaluated under, as resolved for this dimension.
    private Frequency frequency;

    private boolean hasAnomaly;

    @Builder.Default
    private List<AnomalyRecord> anomalies = new ArrayList<>();

    private Severity alertSeverity;

    private int evaluatedPoints;
}
