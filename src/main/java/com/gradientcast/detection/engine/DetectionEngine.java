package com.gradientcast.detection.engine;

import com.gradientcast.detection.config.MetricsConfig;
import com.gradientcast.detection.engine.postprocess.PostProcessor;
import com.gradientcast.detection.exception.InvalidConfigException;
import com.gradientcast.detection.exception.InvalidInputException;
import com.gradientcast.detection.model.AnomalyCandidate;
import com.gradientcast.detection.model.AnomalyRecord;
import com.gradientcast.detection.model.DetectionConfig;
import com.gradientcast.detection.model.DetectionResult;
import com.gradientcast.detection.model.DetectorType;
import com.gradientcast.detection.model.RawDataPoint;
import com.gradientcast.detection.model.ResolvedConfig;
import com.gradientcast.detection.model.TimeSeries;
import com.gradientcast.detection.model.Window;
import com.gradientcast.detection.service.ResultAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Evaluates one dimension end to end: resolve config, validate and slice the
 * series, run the selected detector, post-process (density path only) and
 * aggregate. Uses the Strategy pattern: each DetectorType is handled by a
 * registered {@link Detector}.
 *
 * All validation happens before any scoring; a failure throws a
 * {@link com.gradientcast.detection.exception.DetectionException} for the
 * whole dimension, never a partial result.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<DetectorType, Detector> detectorMap;
    private final ConfigResolver configResolver;
    private final WindowManager windowManager;
    private final PostProcessor postProcessor;
    private final ResultAggregator resultAggregator;
    private final MetricsConfig metricsConfig;

    public DetectionEngine(List<Detector> detectors, ConfigResolver configResolver, WindowManager windowManager,
                           PostProcessor postProcessor, ResultAggregator resultAggregator,
                           MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(DetectorType.class);
        this.configResolver = configResolver;
        this.windowManager = windowManager;
        this.postProcessor = postProcessor;
        this.resultAggregator = resultAggregator;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (Detector detector : detectors) {
            detectorMap.put(detector.getSupportedType(), detector);
            log.info("Registered detector: {} -> {}",
                    detector.getSupportedType(), detector.getClass().getSimpleName());
        }
    }

    public DetectionResult evaluate(String dimensionKey, List<RawDataPoint> raw, DetectionConfig request) {
        // 1. Resolve and validate parameters
        ResolvedConfig config = configResolver.resolve(request, dimensionKey);
        Detector detector = detectorMap.get(config.getDetector());
        if (detector == null) {
            throw new InvalidConfigException("No detector registered for type " + config.getDetector());
        }

        // 2. Validate input and slice the window
        TimeSeries series = windowManager.parse(dimensionKey, raw);
        EvaluationContext context = buildContext(request, dimensionKey);
        Window window = windowManager.slice(series, detector.evaluationSpec(config), detector.minimumHistory(config));

        // 3. Score the evaluation range
        List<AnomalyCandidate> evaluated = detector.evaluate(window, config, context);

        // 4. Post-process (density path) or keep flagged points (threshold path)
        List<AnomalyCandidate> confirmed = config.getDetector().isPostProcessed()
                ? postProcessor.process(evaluated, config)
                : evaluated.stream().filter(AnomalyCandidate::isCandidate).collect(Collectors.toList());

        log.debug("Dimension {}: {} evaluated, {} raw candidates, {} confirmed",
                dimensionKey, evaluated.size(),
                evaluated.stream().filter(AnomalyCandidate::isCandidate).count(), confirmed.size());

        // 5. Aggregate
        DetectionResult result = resultAggregator.aggregate(window, config, evaluated.size(), confirmed);

        metricsConfig.recordEvaluation(config.getDetector().name(), result.isHasAnomaly());
        for (AnomalyRecord record : result.getAnomalies()) {
            metricsConfig.recordAnomaly(config.getDetector().name(), record.getSeverity().name());
        }
        if (result.isHasAnomaly()) {
            log.warn("Anomaly detected for dimension={}: detector={}, anomalies={}, severity={}",
                    dimensionKey, config.getDetector(), result.getAnomalies().size(), result.getAlertSeverity());
        }

        return result;
    }

    private EvaluationContext buildContext(DetectionConfig request, String dimensionKey) {
        if (request == null || request.getExternalBaselines() == null) {
            return EvaluationContext.empty();
        }
        Map<String, Double> raw = request.getExternalBaselines().get(dimensionKey);
        if (raw == null || raw.isEmpty()) {
            return EvaluationContext.empty();
        }

        Map<LocalDateTime, Double> baseline = new HashMap<>();
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            try {
                baseline.put(TimestampFormat.parse(entry.getKey()), entry.getValue());
            } catch (DateTimeParseException e) {
                throw new InvalidInputException("Unparsable external baseline timestamp '"
                        + entry.getKey() + "' for dimension '" + dimensionKey + "'", e);
            }
            if (entry.getValue() == null || entry.getValue().isNaN() || entry.getValue().isInfinite()) {
                throw new InvalidInputException("Non-numeric external baseline at '"
                        + entry.getKey() + "' for dimension '" + dimensionKey + "'");
            }
        }
        return EvaluationContext.builder().externalBaseline(baseline).build();
    }
}
