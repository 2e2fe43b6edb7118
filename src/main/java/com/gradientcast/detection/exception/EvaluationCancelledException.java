package com.gradientcast.detection.exception;

/**
 * Thrown when a batch evaluation observes its cancellation signal between dimensions.
 * Not tied to a single dimension, so it aborts the batch.
 */
public class EvaluationCancelledException extends RuntimeException {

    public EvaluationCancelledException(String message) {
        super(message);
    }

    public EvaluationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
