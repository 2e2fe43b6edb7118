package com.gradientcast.detection.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnomalyRecord {

    @JsonFormat(pattern = "MM/dd/yyyy, hh:mm a", locale = "en_US")
    private LocalDateTime timestamp;

    private double actualValue;

    // detector baseline: rolling mean for DenseAD, preceding-points mean or external forecast for PulseAD
    private double expectedValue;

    private double anomalyScore;

    // 0-100
    private double normalizedScore;

    // against the detector's own rolling window
    private Double zscore;

    // null when the baseline is zero and no ratio exists
    private Double deviationPct;

    @JsonProperty("zscore_24h")
    private Double zscore24h;

    @JsonProperty("expected_value_24h")
    private Double expectedValue24h;

    private Severity severity;
}
