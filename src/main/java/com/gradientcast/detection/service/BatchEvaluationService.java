package com.gradientcast.detection.service;

import com.gradientcast.detection.config.MetricsConfig;
import com.gradientcast.detection.engine.CancellationSignal;
import com.gradientcast.detection.engine.DetectionEngine;
import com.gradientcast.detection.exception.DetectionException;
import com.gradientcast.detection.exception.EvaluationCancelledException;
import com.gradientcast.detection.model.DetectionConfig;
import com.gradientcast.detection.model.DetectionResult;
import com.gradientcast.detection.model.DimensionResult;
import com.gradientcast.detection.model.RawDataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Main entry point for batch evaluation.
 *
 * Flow:
 * 1. Submit one task per dimension to the detection executor
 * 2. Each task checks the cancellation signal, then runs the detection engine
 * 3. Detection failures become that dimension's error entry; the batch goes on
 * 4. Results are collected in request order, whatever order tasks finish in
 *
 * Evaluation is a pure function of (series, config): nothing is kept between calls
 * apart from the rolling-statistics cache, whose hits equal recomputation.
 */
@Service
public class BatchEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(BatchEvaluationService.class);

    private final DetectionEngine detectionEngine;
    private final ExecutorService executor;
    private final MetricsConfig metricsConfig;

    public BatchEvaluationService(DetectionEngine detectionEngine,
                                  @Qualifier("detectionExecutor") ExecutorService executor,
                                  MetricsConfig metricsConfig) {
        this.detectionEngine = detectionEngine;
        this.executor = executor;
        this.metricsConfig = metricsConfig;
    }

    public Map<String, DimensionResult> evaluate(Map<String, List<RawDataPoint>> dimensionData, DetectionConfig config) {
        return evaluate(dimensionData, config, CancellationSignal.none());
    }

    /**
     * Evaluate every dimension of the request.
     *
     * @throws EvaluationCancelledException when {@code signal} is cancelled before all
     *                                      dimensions have started
     */
    public Map<String, DimensionResult> evaluate(Map<String, List<RawDataPoint>> dimensionData,
                                                 DetectionConfig config, CancellationSignal signal) {
        long started = System.nanoTime();
        List<String> keys = new ArrayList<>(dimensionData.keySet());
        List<Future<DimensionResult>> futures = new ArrayList<>(keys.size());

        for (String key : keys) {
            List<RawDataPoint> series = dimensionData.get(key);
            futures.add(executor.submit(() -> evaluateDimension(key, series, config, signal)));
        }

        Map<String, DimensionResult> results = new LinkedHashMap<>();
        try {
            for (int i = 0; i < keys.size(); i++) {
                results.put(keys.get(i), futures.get(i).get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new EvaluationCancelledException("Batch evaluation interrupted", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof EvaluationCancelledException) {
                throw (EvaluationCancelledException) cause;
            }
            log.error("Unexpected failure during batch evaluation: {}", cause.getMessage(), cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Batch evaluation failed", cause);
        }

        metricsConfig.recordBatch(keys.size(), System.nanoTime() - started);
        return results;
    }

    private DimensionResult evaluateDimension(String key, List<RawDataPoint> series,
                                              DetectionConfig config, CancellationSignal signal) {
        if (signal.isCancelled()) {
            throw new EvaluationCancelledException("Batch evaluation cancelled before dimension '" + key + "'");
        }
        try {
            DetectionResult result = detectionEngine.evaluate(key, series, config);
            return DimensionResult.success(result);
        } catch (DetectionException e) {
            log.warn("Dimension {} failed with {}: {}", key, e.getErrorType(), e.getMessage());
            metricsConfig.recordDimensionError(e.getErrorType().name());
            return DimensionResult.failure(key, e.getErrorType(), e.getMessage());
        }
    }

    private static void cancelAll(List<Future<DimensionResult>> futures) {
        for (Future<DimensionResult> future : futures) {
            future.cancel(true);
        }
    }
}
