package com.gradientcast.detection.seeder;

import com.gradientcast.detection.model.ConfigOverride;
import com.gradientcast.detection.model.DetectionConfig;
import com.gradientcast.detection.model.DetectorType;
import com.gradientcast.detection.model.DimensionResult;
import com.gradientcast.detection.model.RawDataPoint;
import com.gradientcast.detection.service.BatchEvaluationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a few synthetic dimensions with both detectors and logs the outcome.
 * Only runs when the "demo" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=demo
 */
@Component
@Profile("demo")
public class DemoRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoRunner.class);

    private final BatchEvaluationService batchEvaluationService;

    public DemoRunner(BatchEvaluationService batchEvaluationService) {
        this.batchEvaluationService = batchEvaluationService;
    }

    @Override
    public void run(String... args) {
        SyntheticSeriesGenerator generator = new SyntheticSeriesGenerator(42);
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 0, 0);

        Map<String, List<RawDataPoint>> data = new LinkedHashMap<>();
        data.put("revenue_clean", generator.payload(168, start, 1_500_000, false, 0.0));
        data.put("revenue_spiky", generator.payload(168, start, 1_500_000, true, 0.05));
        data.put("too_short", generator.payload(10, start, 1_500_000, false, 0.0));

        Map<String, ConfigOverride> overrides = new LinkedHashMap<>();
        overrides.put("revenue_spiky", ConfigOverride.builder().minContiguousAnomalies(1).build());

        for (DetectorType detector : DetectorType.values()) {
            DetectionConfig config = DetectionConfig.builder()
                    .detector(detector)
                    .returnWindowHours(48.0)
                    .perDimensionOverrides(overrides)
                    .build();

            Map<String, DimensionResult> results = batchEvaluationService.evaluate(data, config);
            results.forEach((key, outcome) -> {
                if (outcome.isSuccess()) {
                    log.info("[{}] {}: has_anomaly={}, anomalies={}, alert_severity={}",
                            detector, key, outcome.getResult().isHasAnomaly(),
                            outcome.getResult().getAnomalies().size(), outcome.getResult().getAlertSeverity());
                } else {
                    log.info("[{}] {}: {} - {}", detector, key, outcome.getErrorType(), outcome.getErrorMessage());
                }
            });
        }
    }
}
