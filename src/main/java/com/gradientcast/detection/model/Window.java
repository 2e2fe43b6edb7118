package com.gradientcast.detection.model;

import lombok.Value;

import java.util.List;

/**
 * View over a {@link TimeSeries}: everything before {@code evaluationStart} is
 * context, the rest is the evaluation range.
 */
@Value
public class Window {
    String dimensionKey;
    List<DataPoint> points;
    int evaluationStart;

    public List<DataPoint> context() {
        return points.subList(0, evaluationStart);
    }

    public List<DataPoint> evaluationRange() {
        return points.subList(evaluationStart, points.size());
    }

    public int contextSize() {
        return evaluationStart;
    }

    public int evaluationSize() {
        return points.size() - evaluationStart;
    }
}
