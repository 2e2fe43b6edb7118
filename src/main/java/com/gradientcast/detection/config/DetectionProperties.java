package com.gradientcast.detection.config;

import com.gradientcast.detection.model.Frequency;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    // Built-in defaults: lowest priority in config resolution, below the request's global config.
    private Defaults defaults = new Defaults();

    private Features features = new Features();

    private Execution execution = new Execution();

    private Cache cache = new Cache();

    @Data
    public static class Defaults {
        // DenseAD
        private double contamination = 0.05;
        private int nearestNeighbors = 20;
        private double valleyThreshold = 0.0;
        private int minContiguousAnomalies = 2;
        // PulseAD
        private double percentageThreshold = 0.15;
        private double minimumValueThreshold = 100000.0;
        // Baseline length for PulseAD when the request sets no validation points.
        private int pulseValidationPoints = 24;
        private Frequency frequency = Frequency.HOURLY;
    }

    @Data
    public static class Features {
        // Trailing points used for rolling mean/std.
        private int lookback = 24;
        private double epsilon = 1e-9;
        // z assigned when the window std is zero and value != mean.
        private double maxZScore = 10.0;
        // Shortest series the density detector accepts.
        private int densityMinimumHistory = 24;
        // Context points before this index have too little history to serve as density references.
        private int referenceWarmup = 2;
        private int minSeasonalMatches = 2;
    }

    @Data
    public static class Execution {
        // Worker threads for evaluating dimensions of one batch in parallel.
        private int parallelism = Math.max(2, Runtime.getRuntime().availableProcessors());
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private int maxEntries = 10000;
    }
}
