package com.gradientcast.detection.engine;

import com.gradientcast.detection.exception.InsufficientHistoryException;
import com.gradientcast.detection.exception.InvalidInputException;
import com.gradientcast.detection.model.DataPoint;
import com.gradientcast.detection.model.EvaluationSpec;
import com.gradientcast.detection.model.RawDataPoint;
import com.gradientcast.detection.model.TimeSeries;
import com.gradientcast.detection.model.Window;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Validates raw series and splits them into context and evaluation range.
 */
@Component
public class WindowManager {

    /**
     * Parse and validate raw points. Integers are coerced to double; strings,
     * booleans, NaN and infinities are rejected.
     */
    public TimeSeries parse(String dimensionKey, List<RawDataPoint> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidInputException("Series for dimension '" + dimensionKey + "' is empty");
        }

        List<DataPoint> points = new ArrayList<>(raw.size());
        LocalDateTime previous = null;

        for (int i = 0; i < raw.size(); i++) {
            RawDataPoint point = raw.get(i);
            if (point == null || point.getTimestamp() == null) {
                throw InvalidInputException.unparsableTimestamp(i, null, null);
            }

            LocalDateTime timestamp;
            try {
                timestamp = TimestampFormat.parse(point.getTimestamp());
            } catch (DateTimeParseException e) {
                throw InvalidInputException.unparsableTimestamp(i, point.getTimestamp(), e);
            }

            if (previous != null && !timestamp.isAfter(previous)) {
                throw InvalidInputException.notIncreasing(i, TimestampFormat.format(previous),
                        TimestampFormat.format(timestamp));
            }

            if (!(point.getValue() instanceof Number)) {
                throw InvalidInputException.nonNumericValue(i, point.getValue());
            }
            double value = ((Number) point.getValue()).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw InvalidInputException.nonNumericValue(i, point.getValue());
            }

            points.add(new DataPoint(timestamp, value));
            previous = timestamp;
        }

        return new TimeSeries(dimensionKey, Collections.unmodifiableList(points));
    }

    /**
     * @param minimumHistory shortest series the selected detector accepts
     * @throws InsufficientHistoryException when the series is shorter than {@code minimumHistory}
     *                                      or the evaluation range would leave no context
     */
    public Window slice(TimeSeries series, EvaluationSpec spec, int minimumHistory) {
        int size = series.size();
        if (size < minimumHistory) {
            throw InsufficientHistoryException.of("history for dimension '" + series.getDimensionKey() + "'",
                    minimumHistory, size);
        }

        int evaluationSize;
        switch (spec.getMode()) {
            case LAST_POINTS:
                evaluationSize = spec.getPoints();
                break;
            case RETURN_WINDOW:
                evaluationSize = countWithinHours(series.getPoints(), spec.getHours());
                break;
            case LATEST:
            default:
                evaluationSize = 1;
                break;
        }

        int evaluationStart = size - evaluationSize;
        if (evaluationStart < 1) {
            throw InsufficientHistoryException.of("context for dimension '" + series.getDimensionKey()
                    + "' (evaluation range covers " + evaluationSize + " points)", evaluationSize + 1, size);
        }

        return new Window(series.getDimensionKey(), series.getPoints(), evaluationStart);
    }

    // Points whose timestamp is within `hours` of the last timestamp, the last point included.
    private int countWithinHours(List<DataPoint> points, double hours) {
        LocalDateTime last = points.get(points.size() - 1).getTimestamp();
        LocalDateTime cutoff = last.minus(Duration.ofSeconds(Math.round(hours * 3600.0)));
        int count = 0;
        for (int i = points.size() - 1; i >= 0; i--) {
            if (points.get(i).getTimestamp().isBefore(cutoff)) {
                break;
            }
            count++;
        }
        return count;
    }
}
