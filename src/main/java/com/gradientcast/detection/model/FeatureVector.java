package com.gradientcast.detection.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Features of one point, computed from the points that precede it.
 * Lag and seasonal features are null when the history does not reach them.
 */
@Value
@Builder
public class FeatureVector {

    public enum Dimension {
        VALUE,
        ROLLING_MEAN,
        ROLLING_STD,
        ZSCORE,
        LAG_1,
        LAG_24,
        LAG_168,
        SEASONAL_AVERAGE
    }

    public static final int DIMENSION_COUNT = Dimension.values().length;

    int index;
    LocalDateTime timestamp;
    double value;
    double rollingMean;
    double rollingStd;
    double zscore;
    Double lag1;
    Double lag24;
    Double lag168;
    Double seasonalAverage;

    /**
     * Coordinates in {@link Dimension} order, NaN where a feature is absent.
     */
    public double[] coordinates() {
        return new double[] {
                value,
                rollingMean,
                rollingStd,
                zscore,
                orNaN(lag1),
                orNaN(lag24),
                orNaN(lag168),
                orNaN(seasonalAverage)
        };
    }

    private static double orNaN(Double value) {
        return value != null ? value : Double.NaN;
    }
}
