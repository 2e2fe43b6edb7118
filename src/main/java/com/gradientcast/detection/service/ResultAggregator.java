package com.gradientcast.detection.service;

import com.gradientcast.detection.engine.features.FeatureEngine;
import com.gradientcast.detection.engine.features.RollingStatistics;
import com.gradientcast.detection.model.AnomalyCandidate;
import com.gradientcast.detection.model.AnomalyRecord;
import com.gradientcast.detection.model.DetectionResult;
import com.gradientcast.detection.model.ResolvedConfig;
import com.gradientcast.detection.model.Severity;
import com.gradientcast.detection.model.Window;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the per-dimension {@link DetectionResult} from confirmed anomalies.
 *
 * Every record gets deviation_pct against the detector's expected value, plus
 * zscore_24h and expected_value_24h over the 24 points before it.
 * alert_severity = highest record severity, absent when nothing was confirmed.
 */
@Service
public class ResultAggregator {

    private final FeatureEngine featureEngine;

    public ResultAggregator(FeatureEngine featureEngine) {
        this.featureEngine = featureEngine;
    }

    public DetectionResult aggregate(Window window, ResolvedConfig config, int evaluatedPoints,
                                     List<AnomalyCandidate> confirmed) {
        List<AnomalyRecord> records = new ArrayList<>(confirmed.size());
        Severity alertSeverity = null;

        for (AnomalyCandidate c : confirmed) {
            RollingStatistics day = featureEngine.rollingStatistics(
                    window.getDimensionKey(), window.getPoints(), c.getSeriesIndex(), FeatureEngine.DAY_POINTS);

            records.add(AnomalyRecord.builder()
                    .timestamp(c.getTimestamp())
                    .actualValue(c.getActualValue())
                    .expectedValue(c.getExpectedValue())
                    .anomalyScore(c.getAnomalyScore())
                    .normalizedScore(c.getNormalizedScore())
                    .zscore(c.getZscore())
                    .deviationPct(c.getDeviationPct() != null
                            ? c.getDeviationPct()
                            : deviationPct(c.getActualValue(), c.getExpectedValue()))
                    .zscore24h(featureEngine.zScore(day, c.getActualValue()))
                    .expectedValue24h(day.getMean())
                    .severity(c.getSeverity())
                    .build());

            alertSeverity = Severity.max(alertSeverity, c.getSeverity());
        }

        return DetectionResult.builder()
                .dimensionKey(window.getDimensionKey())
                .detector(config.getDetector())
                .frequency(config.getFrequency())
                .hasAnomaly(!records.isEmpty())
                .anomalies(records)
                .alertSeverity(alertSeverity)
                .evaluatedPoints(evaluatedPoints)
                .build();
    }

    /**
     * (actual - expected) / expected; 0 when both are 0, null when only expected is.
     */
    static Double deviationPct(double actual, double expected) {
        if (expected == 0.0) {
            return actual == 0.0 ? 0.0 : null;
        }
        return (actual - expected) / expected;
    }
}
