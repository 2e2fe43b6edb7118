package com.gradientcast.detection.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.gradientcast.detection.exception.DetectionErrorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Batch entry for one dimension: either a full result or a tagged error, never both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DimensionResult {

    private String dimensionKey;

    private DetectionResult result;

    private DetectionErrorType errorType;

    private String errorMessage;

    public static DimensionResult success(DetectionResult result) {
        return DimensionResult.builder()
                .dimensionKey(result.getDimensionKey())
                .result(result)
                .build();
    }

    public static DimensionResult failure(String dimensionKey, DetectionErrorType errorType, String message) {
        return DimensionResult.builder()
                .dimensionKey(dimensionKey)
                .errorType(errorType)
                .errorMessage(message)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return result != null;
    }
}
