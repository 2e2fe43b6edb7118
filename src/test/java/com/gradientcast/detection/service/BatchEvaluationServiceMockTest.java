package com.gradientcast.detection.service;

import com.gradientcast.detection.config.MetricsConfig;
import com.gradientcast.detection.engine.DetectionEngine;
import com.gradientcast.detection.exception.DetectionErrorType;
import com.gradientcast.detection.exception.InsufficientHistoryException;
import com.gradientcast.detection.model.DetectionConfig;
import com.gradientcast.detection.model.DetectionResult;
import com.gradientcast.detection.model.DimensionResult;
import com.gradientcast.detection.model.RawDataPoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchEvaluationServiceMockTest {

    @Mock private DetectionEngine detectionEngine;
    @Mock private MetricsConfig metricsConfig;

    private ExecutorService executor;
    private BatchEvaluationService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        service = new BatchEvaluationService(detectionEngine, executor, metricsConfig);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void evaluate_detectionException_becomesErrorEntryAndMetric() {
        when(detectionEngine.evaluate(eq("revenue"), any(), any()))
                .thenThrow(InsufficientHistoryException.of("history", 24, 3));

        Map<String, DimensionResult> results = service.evaluate(request("revenue"), new DetectionConfig());

        DimensionResult entry = results.get("revenue");
        assertThat(entry.isSuccess()).isFalse();
        assertThat(entry.getErrorType()).isEqualTo(DetectionErrorType.INSUFFICIENT_HISTORY);
        assertThat(entry.getErrorMessage()).contains("need at least 24");
        verify(metricsConfig).recordDimensionError("INSUFFICIENT_HISTORY");
    }

    @Test
    void evaluate_unexpectedFailure_propagates() {
        when(detectionEngine.evaluate(eq("revenue"), any(), any()))
                .thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> service.evaluate(request("revenue"), new DetectionConfig()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void evaluate_success_wrapsEngineResult() {
        DetectionResult result = DetectionResult.builder().dimensionKey("revenue").evaluatedPoints(1).build();
        when(detectionEngine.evaluate(eq("revenue"), any(), any())).thenReturn(result);

        Map<String, DimensionResult> results = service.evaluate(request("revenue"), new DetectionConfig());

        assertThat(results.get("revenue").getResult()).isSameAs(result);
        verify(metricsConfig).recordBatch(eq(1), anyLong());
    }

    private static Map<String, List<RawDataPoint>> request(String key) {
        Map<String, List<RawDataPoint>> data = new LinkedHashMap<>();
        data.put(key, Collections.emptyList());
        return data;
    }
}
