package com.gradientcast.detection.engine.features;

import com.gradientcast.detection.config.DetectionProperties;
import com.gradientcast.detection.model.DataPoint;
import com.gradientcast.detection.model.FeatureVector;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes per-point features from the points that precede it in the series.
 *
 * <p>Features:
 * <ul>
 *   <li>rolling mean / population std over the trailing {@code lookback} points</li>
 *   <li>z-score of the value against that window (see {@link RollingStatistics#zScore})</li>
 *   <li>lag-1, lag-24, lag-168 values, omitted when the series does not reach back that far</li>
 *   <li>seasonal average: mean of earlier values with the same hour-of-day and
 *       day-of-week, when at least {@code minSeasonalMatches} exist</li>
 * </ul>
 */
@Component
public class FeatureEngine {

    public static final int DAY_POINTS = 24;
    public static final int WEEK_POINTS = 168;

    private final DetectionProperties.Features settings;
    private final RollingStatisticsCache cache;

    public FeatureEngine(DetectionProperties properties, RollingStatisticsCache cache) {
        this.settings = properties.getFeatures();
        this.cache = cache;
    }

    public FeatureVector compute(String dimensionKey, List<DataPoint> points, int index) {
        DataPoint point = points.get(index);
        RollingStatistics stats = rollingStatistics(dimensionKey, points, index, settings.getLookback());

        return FeatureVector.builder()
                .index(index)
                .timestamp(point.getTimestamp())
                .value(point.getValue())
                .rollingMean(stats.getMean())
                .rollingStd(stats.getStd())
                .zscore(zScore(stats, point.getValue()))
                .lag1(lag(points, index, 1))
                .lag24(lag(points, index, DAY_POINTS))
                .lag168(lag(points, index, WEEK_POINTS))
                .seasonalAverage(seasonalAverage(points, index))
                .build();
    }

    /**
     * Features for every index in {@code [fromIndex, toIndex)}.
     */
    public List<FeatureVector> computeRange(String dimensionKey, List<DataPoint> points, int fromIndex, int toIndex) {
        List<FeatureVector> vectors = new ArrayList<>(Math.max(0, toIndex - fromIndex));
        for (int i = fromIndex; i < toIndex; i++) {
            vectors.add(compute(dimensionKey, points, i));
        }
        return vectors;
    }

    /**
     * Statistics of the up to {@code lookback} points strictly before {@code index}.
     */
    public RollingStatistics rollingStatistics(String dimensionKey, List<DataPoint> points, int index, int lookback) {
        int start = Math.max(0, index - lookback);
        if (start >= index) {
            return new RollingStatistics(0, 0.0, 0.0);
        }
        double[] values = new double[index - start];
        for (int i = start; i < index; i++) {
            values[i - start] = points.get(i).getValue();
        }
        LocalDateTime windowEnd = points.get(index - 1).getTimestamp();
        return cache.get(dimensionKey, windowEnd, lookback, values, () -> RollingStatistics.of(values));
    }

    public double zScore(RollingStatistics stats, double value) {
        return stats.zScore(value, settings.getEpsilon(), settings.getMaxZScore());
    }

    private static Double lag(List<DataPoint> points, int index, int offset) {
        int i = index - offset;
        return i >= 0 ? points.get(i).getValue() : null;
    }

    private Double seasonalAverage(List<DataPoint> points, int index) {
        LocalDateTime at = points.get(index).getTimestamp();
        double sum = 0.0;
        int matches = 0;
        for (int i = 0; i < index; i++) {
            LocalDateTime t = points.get(i).getTimestamp();
            if (t.getHour() == at.getHour() && t.getDayOfWeek() == at.getDayOfWeek()) {
                sum += points.get(i).getValue();
                matches++;
            }
        }
        return matches >= settings.getMinSeasonalMatches() ? sum / matches : null;
    }
}
