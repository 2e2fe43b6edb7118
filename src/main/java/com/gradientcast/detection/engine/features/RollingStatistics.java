package com.gradientcast.detection.engine.features;

import lombok.Value;

import java.util.List;

/**
 * Mean and population standard deviation of a trailing window of values.
 */
@Value
public class RollingStatistics {
    int count;
    double mean;
    double std;

    public static RollingStatistics of(double[] values) {
        int n = values.length;
        if (n == 0) {
            return new RollingStatistics(0, 0.0, 0.0);
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;
        double m2 = 0.0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
        }
        return new RollingStatistics(n, mean, Math.sqrt(m2 / n));
    }

    public static RollingStatistics of(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return of(array);
    }

    /**
     * z of {@code value} against this window: {@code (value - mean) / max(std, epsilon)}.
     * A zero std gives 0 when the value equals the mean and {@code +-maxZ} otherwise.
     */
    public double zScore(double value, double epsilon, double maxZ) {
        double diff = value - mean;
        if (std == 0.0) {
            return diff == 0.0 ? 0.0 : Math.copySign(maxZ, diff);
        }
        return diff / Math.max(std, epsilon);
    }
}
