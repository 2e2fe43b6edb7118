package com.gradientcast.detection.exception;

/**
 * Raised when a resolved parameter is out of range or an override cannot be resolved.
 */
public class InvalidConfigException extends DetectionException {

    public InvalidConfigException(String message) {
        super(DetectionErrorType.INVALID_CONFIG, message);
    }

    public static InvalidConfigException invalidParameter(String paramName, Object value, String expected) {
        return new InvalidConfigException(
                String.format("Invalid parameter '%s': got '%s', expected %s", paramName, value, expected));
    }
}
