package com.gradientcast.detection.engine;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;

/**
 * Per-dimension runtime inputs that are not part of the series itself.
 */
@Value
@Builder
public class EvaluationContext {

    // Expected values supplied by an external forecaster, keyed by timestamp (PulseAD only).
    @Builder.Default
    Map<LocalDateTime, Double> externalBaseline = Collections.emptyMap();

    public static EvaluationContext empty() {
        return EvaluationContext.builder().build();
    }
}
