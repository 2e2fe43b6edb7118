package com.gradientcast.detection.engine.detectors;

import com.gradientcast.detection.config.DetectionProperties;
import com.gradientcast.detection.engine.Detector;
import com.gradientcast.detection.engine.EvaluationContext;
import com.gradientcast.detection.engine.features.FeatureEngine;
import com.gradientcast.detection.exception.InvalidConfigException;
import com.gradientcast.detection.model.AnomalyCandidate;
import com.gradientcast.detection.model.DataPoint;
import com.gradientcast.detection.model.DetectorType;
import com.gradientcast.detection.model.EvaluationSpec;
import com.gradientcast.detection.model.FeatureVector;
import com.gradientcast.detection.model.ResolvedConfig;
import com.gradientcast.detection.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * DenseAD: flags evaluated points whose feature vector sits in a sparse region
 * relative to the context.
 *
 * Reference set: context points from index {@code referenceWarmup} on, so every
 * reference has at least that many earlier points behind its rolling features.
 * Evaluated points are scored against the references only; their own features
 * use every earlier point, earlier evaluated points included.
 *
 * n_neighbors is bounded by the window length ({@code [1, points - 1]}); when it
 * exceeds the references available the scorer uses all of them.
 *
 * Output is raw: one candidate per evaluated point, flagged when its normalized
 * score reaches 50. Valley, contiguity and severity are applied afterwards.
 */
@Component
public class DenseAnomalyDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(DenseAnomalyDetector.class);

    private final FeatureEngine featureEngine;
    private final DensityScorer densityScorer;
    private final DetectionProperties.Features settings;

    public DenseAnomalyDetector(FeatureEngine featureEngine, DensityScorer densityScorer,
                                DetectionProperties properties) {
        this.featureEngine = featureEngine;
        this.densityScorer = densityScorer;
        this.settings = properties.getFeatures();
    }

    @Override
    public DetectorType getSupportedType() {
        return DetectorType.DENSE_AD;
    }

    @Override
    public int minimumHistory(ResolvedConfig config) {
        return settings.getDensityMinimumHistory();
    }

    @Override
    public EvaluationSpec evaluationSpec(ResolvedConfig config) {
        if (config.getReturnWindowHours() != null) {
            return EvaluationSpec.returnWindow(config.getReturnWindowHours());
        }
        if (config.getValidationPoints() != null) {
            return EvaluationSpec.lastPoints(config.getValidationPoints());
        }
        return EvaluationSpec.latest();
    }

    @Override
    public List<AnomalyCandidate> evaluate(Window window, ResolvedConfig config, EvaluationContext context) {
        String dimensionKey = window.getDimensionKey();
        List<DataPoint> points = window.getPoints();

        int windowLength = points.size();
        if (config.getNNeighbors() > windowLength - 1) {
            throw InvalidConfigException.invalidParameter("n_neighbors", config.getNNeighbors(),
                    String.format("a value in [1, %d] for a window of %d points", windowLength - 1, windowLength));
        }

        int warmup = Math.min(settings.getReferenceWarmup(), window.contextSize());
        List<FeatureVector> references = featureEngine.computeRange(dimensionKey, points, warmup, window.contextSize());

        List<FeatureVector> evaluated = featureEngine.computeRange(dimensionKey, points,
                window.getEvaluationStart(), points.size());

        DensityScorer.DensityScores scores = densityScorer.score(references, evaluated,
                config.getNNeighbors(), config.getContamination());

        log.debug("DenseAD {}: {} references, k={}, median kNN distance={}, pivot={}",
                dimensionKey, references.size(), scores.getNeighbours(), scores.getMedianDistance(), scores.getPivot());

        List<AnomalyCandidate> candidates = new ArrayList<>(evaluated.size());
        for (int i = 0; i < evaluated.size(); i++) {
            FeatureVector features = evaluated.get(i);
            double normalized = scores.getNormalizedScores().get(i);
            candidates.add(AnomalyCandidate.builder()
                    .seriesIndex(features.getIndex())
                    .timestamp(features.getTimestamp())
                    .actualValue(features.getValue())
                    .expectedValue(features.getRollingMean())
                    .zscore(features.getZscore())
                    .anomalyScore(scores.getAnomalyScores().get(i))
                    .normalizedScore(normalized)
                    .candidate(normalized >= DensityScorer.DECISION_BOUNDARY)
                    .config(config)
                    .build());
        }
        return candidates;
    }
}
