package com.gradientcast.detection.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Scored evaluation-range point before post-processing. Detectors emit one per
 * evaluated point; {@code candidate} marks the ones past the decision boundary.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyCandidate {
    int seriesIndex;
    LocalDateTime timestamp;
    double actualValue;
    double expectedValue;
    double anomalyScore;
    double normalizedScore;
    double zscore;
    boolean candidate;
    // PulseAD fills this in; DenseAD leaves it to the aggregator
    Double deviationPct;
    Severity severity;
    ResolvedConfig config;
}
