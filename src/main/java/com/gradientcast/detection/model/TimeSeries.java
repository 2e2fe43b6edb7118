package com.gradientcast.detection.model;

import lombok.Value;

import java.util.List;

/**
 * Validated series for one dimension. Timestamps are strictly increasing.
 */
@Value
public class TimeSeries {
    String dimensionKey;
    List<DataPoint> points;

    public int size() {
        return points.size();
    }

    public DataPoint last() {
        return points.get(points.size() - 1);
    }
}
