package com.gradientcast.detection.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Which trailing points of a series are evaluated.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EvaluationSpec {

    public enum Mode {
        LATEST,
        LAST_POINTS,
        RETURN_WINDOW
    }

    Mode mode;
    int points;
    double hours;

    public static EvaluationSpec latest() {
        return new EvaluationSpec(Mode.LATEST, 1, 0.0);
    }

    public static EvaluationSpec lastPoints(int points) {
        return new EvaluationSpec(Mode.LAST_POINTS, points, 0.0);
    }

    public static EvaluationSpec returnWindow(double hours) {
        return new EvaluationSpec(Mode.RETURN_WINDOW, 0, hours);
    }
}
