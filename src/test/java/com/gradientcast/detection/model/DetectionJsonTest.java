package com.gradientcast.detection.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionJsonTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void detectionResult_serializesSnakeCaseWithWireTimestamp() throws Exception {
        AnomalyRecord record = AnomalyRecord.builder()
                .timestamp(LocalDateTime.of(2024, 3, 14, 13, 0))
                .actualValue(500_000)
                .expectedValue(3_115_000)
                .anomalyScore(26.6)
                .normalizedScore(100.0)
                .zscore(-37.78)
                .deviationPct(-0.8395)
                .zscore24h(-37.78)
                .expectedValue24h(3_115_000.0)
                .severity(Severity.CRITICAL)
                .build();
        DetectionResult result = DetectionResult.builder()
                .dimensionKey("revenue")
                .detector(DetectorType.DENSE_AD)
                .frequency(Frequency.HOURLY)
                .hasAnomaly(true)
                .anomalies(List.of(record))
                .alertSeverity(Severity.CRITICAL)
                .evaluatedPoints(1)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.get("has_anomaly").asBoolean()).isTrue();
        assertThat(json.get("alert_severity").asText()).isEqualTo("critical");
        assertThat(json.get("frequency").asText()).isEqualTo("H");
        JsonNode anomaly = json.get("anomalies").get(0);
        assertThat(anomaly.get("timestamp").asText()).isEqualTo("03/14/2024, 01:00 PM");
        assertThat(anomaly.get("severity").asText()).isEqualTo("critical");
        assertThat(anomaly.get("zscore_24h").asDouble()).isEqualTo(-37.78);
        assertThat(anomaly.get("expected_value_24h").asDouble()).isEqualTo(3_115_000.0);
        assertThat(anomaly.has("deviation_pct")).isTrue();
    }

    @Test
    void detectionResult_noAnomaly_omitsAlertSeverity() throws Exception {
        DetectionResult result = DetectionResult.builder()
                .dimensionKey("revenue")
                .detector(DetectorType.DENSE_AD)
                .hasAnomaly(false)
                .evaluatedPoints(1)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.has("alert_severity")).isFalse();
        assertThat(json.get("anomalies")).isEmpty();
    }

    @Test
    void detectionConfig_readsSnakeCaseAndFrequencyCode() throws Exception {
        String body = "{"
                + "\"detector\": \"PULSE_AD\","
                + "\"n_neighbors\": 5,"
                + "\"frequency\": \"D\","
                + "\"return_window_hours\": 12,"
                + "\"per_dimension_overrides\": {\"metric_a\": {\"min_contiguous_anomalies\": 1, \"n_neighbors\": 3}}"
                + "}";

        DetectionConfig config = mapper.readValue(body, DetectionConfig.class);

        assertThat(config.getDetector()).isEqualTo(DetectorType.PULSE_AD);
        assertThat(config.getNNeighbors()).isEqualTo(5);
        assertThat(config.getFrequency()).isEqualTo(Frequency.DAILY);
        assertThat(config.getReturnWindowHours()).isEqualTo(12.0);
        assertThat(config.getPerDimensionOverrides().get("metric_a").getMinContiguousAnomalies()).isEqualTo(1);
        assertThat(config.getPerDimensionOverrides().get("metric_a").getNNeighbors()).isEqualTo(3);
    }
}
