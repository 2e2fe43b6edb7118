package com.gradientcast.detection.seeder;

import com.gradientcast.detection.engine.TimestampFormat;
import com.gradientcast.detection.model.Frequency;
import com.gradientcast.detection.model.RawDataPoint;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Deterministic synthetic series for demos and tests. The same seed yields the
 * same series.
 */
public class SyntheticSeriesGenerator {

    public enum Trend {
        LINEAR,
        EXPONENTIAL,
        LOGARITHMIC,
        FLAT
    }

    public enum Seasonality {
        HOURLY(24),
        DAILY(7),
        WEEKLY(52),
        MONTHLY(12),
        YEARLY(1);

        private final int period;

        Seasonality(int period) {
            this.period = period;
        }

        public int getPeriod() {
            return period;
        }
    }

    public enum Direction {
        UP,
        DOWN,
        BOTH
    }

    @Value
    public static class AnomalySeries {
        List<Double> values;
        List<Boolean> anomalyFlags;
    }

    private final Random random;

    public SyntheticSeriesGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * Trend plus gaussian noise with std {@code noiseLevel * baseValue}.
     */
    public List<Double> trendSeries(int n, Trend trend, double baseValue, double strength, double noiseLevel) {
        List<Double> values = new ArrayList<>(n);
        for (int t = 0; t < n; t++) {
            double level;
            switch (trend) {
                case LINEAR:
                    level = baseValue + strength * t;
                    break;
                case EXPONENTIAL:
                    level = baseValue * Math.pow(1 + 0.01 * strength, t);
                    break;
                case LOGARITHMIC:
                    level = baseValue + strength * 10 * Math.log1p(t);
                    break;
                case FLAT:
                default:
                    level = baseValue;
                    break;
            }
            values.add(level + noise(baseValue * noiseLevel));
        }
        return values;
    }

    /**
     * Sine seasonality of relative {@code amplitude} around {@code baseValue}.
     */
    public List<Double> seasonalSeries(int n, double baseValue, Seasonality seasonality,
                                       double amplitude, double noiseLevel) {
        List<Double> values = new ArrayList<>(n);
        for (int t = 0; t < n; t++) {
            double seasonal = baseValue * amplitude * Math.sin(2 * Math.PI * t / seasonality.getPeriod());
            values.add(baseValue + seasonal + noise(baseValue * noiseLevel));
        }
        return values;
    }

    public List<Double> trendSeasonalSeries(int n, double baseValue, double trendStrength, int seasonalPeriod,
                                            double seasonalAmplitude, double noiseLevel) {
        List<Double> values = new ArrayList<>(n);
        for (int t = 0; t < n; t++) {
            double trend = baseValue + trendStrength * t;
            double seasonal = baseValue * seasonalAmplitude * Math.sin(2 * Math.PI * t / seasonalPeriod);
            values.add(trend + seasonal + noise(baseValue * noiseLevel));
        }
        return values;
    }

    /**
     * Slowly rising series with shifts of {@code magnitude * baseValue} injected at
     * {@code anomalyIndices}. A null index list picks about 5% of the points at random.
     */
    public AnomalySeries anomalySeries(int n, double baseValue, List<Integer> anomalyIndices,
                                       double magnitude, Direction direction, double noiseLevel) {
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = baseValue + 0.001 * baseValue * t + noise(baseValue * noiseLevel);
        }

        List<Integer> indices = anomalyIndices != null ? anomalyIndices : pickIndices(0, n, Math.max(1, (int) (n * 0.05)));
        Boolean[] flags = new Boolean[n];
        Arrays.fill(flags, Boolean.FALSE);

        for (int idx : indices) {
            if (idx < 0 || idx >= n) continue;
            int sign;
            switch (direction) {
                case UP:
                    sign = 1;
                    break;
                case DOWN:
                    sign = -1;
                    break;
                case BOTH:
                default:
                    sign = random.nextBoolean() ? 1 : -1;
                    break;
            }
            values[idx] += sign * baseValue * magnitude;
            flags[idx] = Boolean.TRUE;
        }

        List<Double> valueList = new ArrayList<>(n);
        for (double v : values) {
            valueList.add(v);
        }
        return new AnomalySeries(valueList, Arrays.asList(flags));
    }

    /**
     * {@code n} wire-format timestamps starting at {@code start}, one {@code frequency} step apart.
     */
    public static List<String> timestamps(int n, LocalDateTime start, Frequency frequency) {
        List<String> timestamps = new ArrayList<>(n);
        LocalDateTime current = start;
        for (int i = 0; i < n; i++) {
            timestamps.add(TimestampFormat.format(current));
            current = frequency.next(current);
        }
        return timestamps;
    }

    /**
     * Hourly payload with integer values. When {@code injectAnomalies} is set,
     * {@code anomalyRatio} of the points in the second half are shifted by 40%.
     */
    public List<RawDataPoint> payload(int n, LocalDateTime start, double baseValue,
                                      boolean injectAnomalies, double anomalyRatio) {
        List<String> timestamps = timestamps(n, start, Frequency.HOURLY);
        List<Integer> indices = injectAnomalies
                ? pickIndices(n / 2, n, Math.max(1, (int) (n * anomalyRatio)))
                : Collections.emptyList();
        AnomalySeries series = anomalySeries(n, baseValue, indices, 0.4, Direction.BOTH, 0.03);

        List<RawDataPoint> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(RawDataPoint.of(timestamps.get(i), (long) series.getValues().get(i).doubleValue()));
        }
        return points;
    }

    private double noise(double std) {
        return random.nextGaussian() * std;
    }

    // count distinct indices from [from, to), sorted
    private List<Integer> pickIndices(int from, int to, int count) {
        List<Integer> pool = new ArrayList<>();
        for (int i = from; i < to; i++) {
            pool.add(i);
        }
        Collections.shuffle(pool, random);
        List<Integer> picked = new ArrayList<>(pool.subList(0, Math.min(count, pool.size())));
        Collections.sort(picked);
        return picked;
    }
}
