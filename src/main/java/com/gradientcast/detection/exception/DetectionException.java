package com.gradientcast.detection.exception;

/**
 * Base unchecked exception for failures that isolate to a single dimension.
 *
 * <p>The batch service catches these and reports them as the dimension's error
 * entry instead of aborting the whole request. Subclasses fix the
 * {@link DetectionErrorType} tag.
 */
public class DetectionException extends RuntimeException {

    private final DetectionErrorType errorType;

    public DetectionException(DetectionErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DetectionException(DetectionErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public DetectionErrorType getErrorType() {
        return errorType;
    }
}
