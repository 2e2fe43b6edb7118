package com.gradientcast.detection.exception;

/**
 * Raised when a series is shorter than the selected detector's minimum history.
 */
public class InsufficientHistoryException extends DetectionException {

    public InsufficientHistoryException(String message) {
        super(DetectionErrorType.INSUFFICIENT_HISTORY, message);
    }

    public static InsufficientHistoryException of(String what, int required, int actual) {
        return new InsufficientHistoryException(
                String.format("Insufficient %s: need at least %d, but got %d", what, required, actual));
    }
}
