package com.gradientcast.detection.engine.detectors;

import com.gradientcast.detection.config.DetectionProperties;
import com.gradientcast.detection.engine.Detector;
import com.gradientcast.detection.engine.EvaluationContext;
import com.gradientcast.detection.engine.features.FeatureEngine;
import com.gradientcast.detection.engine.features.RollingStatistics;
import com.gradientcast.detection.exception.InsufficientHistoryException;
import com.gradientcast.detection.exception.InvalidInputException;
import com.gradientcast.detection.model.AnomalyCandidate;
import com.gradientcast.detection.model.DataPoint;
import com.gradientcast.detection.model.DetectorType;
import com.gradientcast.detection.model.EvaluationSpec;
import com.gradientcast.detection.model.ResolvedConfig;
import com.gradientcast.detection.model.Severity;
import com.gradientcast.detection.model.Window;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * PulseAD: dual-criterion deviation detector.
 *
 * Logic: the expected value of an evaluated point is the mean of the
 * {@code validation_points} points immediately before it, or the externally
 * supplied forecast for its timestamp when one is given. The point is flagged
 * when BOTH |deviation| > percentage_threshold AND actual > minimum_value_threshold.
 *
 * Example: expected 1,500,000, actual 800,000 gives deviation -0.4667. With the
 * defaults (0.15, 100,000) the point is flagged.
 *
 * Severity comes straight from the deviation: normalized score =
 * 50 * |deviation| / percentage_threshold, capped at 100, then the usual bands.
 * The deviation is measured in units of the threshold rather than as
 * |deviation| * 100 so the threshold sits on the same 50-point decision boundary
 * DenseAD uses. On the raw percent scale a flagged 16% drop (threshold 0.15)
 * would score 16, fall in the none band and lose its severity. Here a flagged
 * point always lands at medium or above, reaching critical at 1.7x the threshold.
 */
@Component
public class PulseAnomalyDetector implements Detector {

    private final FeatureEngine featureEngine;
    private final DetectionProperties properties;

    public PulseAnomalyDetector(FeatureEngine featureEngine, DetectionProperties properties) {
        this.featureEngine = featureEngine;
        this.properties = properties;
    }

    @Override
    public DetectorType getSupportedType() {
        return DetectorType.PULSE_AD;
    }

    @Override
    public int minimumHistory(ResolvedConfig config) {
        return baselinePoints(config) + 1;
    }

    /**
     * validation_points sizes the baseline here, so only the return window widens the range.
     */
    @Override
    public EvaluationSpec evaluationSpec(ResolvedConfig config) {
        if (config.getReturnWindowHours() != null) {
            return EvaluationSpec.returnWindow(config.getReturnWindowHours());
        }
        return EvaluationSpec.latest();
    }

    @Override
    public List<AnomalyCandidate> evaluate(Window window, ResolvedConfig config, EvaluationContext context) {
        int baselinePoints = baselinePoints(config);
        if (window.getEvaluationStart() < baselinePoints) {
            throw InsufficientHistoryException.of("baseline points before the evaluation range of '"
                    + window.getDimensionKey() + "'", baselinePoints, window.getEvaluationStart());
        }

        List<DataPoint> points = window.getPoints();
        List<AnomalyCandidate> candidates = new ArrayList<>(window.evaluationSize());

        for (int i = window.getEvaluationStart(); i < points.size(); i++) {
            DataPoint point = points.get(i);
            RollingStatistics baseline = featureEngine.rollingStatistics(
                    window.getDimensionKey(), points, i, baselinePoints);

            Double external = context.getExternalBaseline().get(point.getTimestamp());
            double expected = external != null ? external : baseline.getMean();
            double actual = point.getValue();

            double deviationPct = deviation(actual, expected, window.getDimensionKey(), point);
            double magnitude = Math.abs(deviationPct);
            boolean flagged = magnitude > config.getPercentageThreshold()
                    && actual > config.getMinimumValueThreshold();
            double normalized = Math.min(100.0,
                    DensityScorer.DECISION_BOUNDARY * magnitude / config.getPercentageThreshold());

            candidates.add(AnomalyCandidate.builder()
                    .seriesIndex(i)
                    .timestamp(point.getTimestamp())
                    .actualValue(actual)
                    .expectedValue(expected)
                    .zscore(featureEngine.zScore(baseline, actual))
                    .anomalyScore(magnitude)
                    .normalizedScore(normalized)
                    .deviationPct(deviationPct)
                    .candidate(flagged)
                    .severity(flagged ? Severity.fromScore(normalized) : Severity.NONE)
                    .config(config)
                    .build());
        }
        return candidates;
    }

    /**
     * (actual - expected) / expected; 0 when both are 0.
     *
     * @throws InvalidInputException when expected is 0 and actual is not
     */
    static double deviation(double actual, double expected, String dimensionKey, DataPoint point) {
        if (expected == 0.0) {
            if (actual == 0.0) {
                return 0.0;
            }
            throw new InvalidInputException(String.format(
                    "Expected value is 0 for dimension '%s' at %s while actual is %s; deviation is undefined",
                    dimensionKey, point.getTimestamp(), actual));
        }
        return (actual - expected) / expected;
    }

    private int baselinePoints(ResolvedConfig config) {
        return config.getValidationPoints() != null
                ? config.getValidationPoints()
                : properties.getDefaults().getPulseValidationPoints();
    }
}
