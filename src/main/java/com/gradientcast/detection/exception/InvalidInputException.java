package com.gradientcast.detection.exception;

/**
 * Raised for malformed series data: unparsable or out-of-order timestamps,
 * non-numeric values, or a baseline that cannot be divided by.
 */
public class InvalidInputException extends DetectionException {

    public InvalidInputException(String message) {
        super(DetectionErrorType.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(DetectionErrorType.INVALID_INPUT, message, cause);
    }

    public static InvalidInputException unparsableTimestamp(int position, String raw, Throwable cause) {
        return new InvalidInputException(
                String.format("Unparsable timestamp at position %d: '%s', expected MM/DD/YYYY, HH:MM AM/PM",
                        position, raw), cause);
    }

    public static InvalidInputException nonNumericValue(int position, Object raw) {
        return new InvalidInputException(
                String.format("Non-numeric value at position %d: '%s'", position, raw));
    }

    public static InvalidInputException notIncreasing(int position, Object previous, Object current) {
        return new InvalidInputException(
                String.format("Timestamps must be strictly increasing: position %d has %s after %s",
                        position, current, previous));
    }
}
