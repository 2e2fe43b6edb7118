package com.gradientcast.detection.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEvaluation(String detector, boolean hasAnomaly) {
        Counter.builder("detection.evaluation.count")
                .tag("detector", detector)
                .tag("outcome", hasAnomaly ? "anomaly" : "normal")
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String detector, String severity) {
        Counter.builder("detection.anomaly.count")
                .tag("detector", detector)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDimensionError(String errorType) {
        Counter.builder("detection.dimension.error.count")
                .tag("error_type", errorType)
                .register(registry)
                .increment();
    }

    public void recordBatch(int dimensions, long elapsedNanos) {
        Timer.builder("detection.batch.duration")
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);

        registry.summary("detection.batch.dimensions").record(dimensions);
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("detection.rolling_cache.lookup.count")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }
}
