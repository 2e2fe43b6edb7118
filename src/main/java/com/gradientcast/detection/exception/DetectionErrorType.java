package com.gradientcast.detection.exception;

/**
 * Error categories reported per dimension in batch responses.
 */
public enum DetectionErrorType {
    INVALID_INPUT,
    INSUFFICIENT_HISTORY,
    INVALID_CONFIG,
    COMPUTATION_DEGENERATE
}
