package com.gradientcast.detection.engine;

import com.gradientcast.detection.config.DetectionProperties;
import com.gradientcast.detection.exception.InvalidConfigException;
import com.gradientcast.detection.model.ConfigOverride;
import com.gradientcast.detection.model.DetectionConfig;
import com.gradientcast.detection.model.DetectorType;
import com.gradientcast.detection.model.ResolvedConfig;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Merges built-in defaults, the request's global config and the dimension's
 * override, in increasing priority. A field left null at one level falls
 * through to the next lower one. Overrides keyed by dimensions that are not in
 * the request are simply never looked up.
 */
@Component
public class ConfigResolver {

    private final DetectionProperties properties;

    public ConfigResolver(DetectionProperties properties) {
        this.properties = properties;
    }

    public ResolvedConfig resolve(DetectionConfig global, Map<String, ConfigOverride> overrides, String dimensionKey) {
        DetectionProperties.Defaults defaults = properties.getDefaults();
        DetectionConfig g = global != null ? global : new DetectionConfig();

        ConfigOverride o = new ConfigOverride();
        if (overrides != null && overrides.containsKey(dimensionKey)) {
            o = overrides.get(dimensionKey);
            if (o == null) {
                throw new InvalidConfigException(
                        "Override for dimension '" + dimensionKey + "' is present but empty");
            }
        }

        ResolvedConfig resolved = ResolvedConfig.builder()
                .dimensionKey(dimensionKey)
                .detector(g.getDetector() != null ? g.getDetector() : DetectorType.DENSE_AD)
                .contamination(pick(o.getContamination(), g.getContamination(), defaults.getContamination()))
                .nNeighbors(pick(o.getNNeighbors(), g.getNNeighbors(), defaults.getNearestNeighbors()))
                .valleyThreshold(pick(o.getValleyThreshold(), g.getValleyThreshold(), defaults.getValleyThreshold()))
                .minContiguousAnomalies(pick(o.getMinContiguousAnomalies(), g.getMinContiguousAnomalies(),
                        defaults.getMinContiguousAnomalies()))
                .percentageThreshold(pick(o.getPercentageThreshold(), g.getPercentageThreshold(),
                        defaults.getPercentageThreshold()))
                .minimumValueThreshold(pick(o.getMinimumValueThreshold(), g.getMinimumValueThreshold(),
                        defaults.getMinimumValueThreshold()))
                .frequency(pick(o.getFrequency(), g.getFrequency(), defaults.getFrequency()))
                .returnWindowHours(o.getReturnWindowHours() != null ? o.getReturnWindowHours() : g.getReturnWindowHours())
                .validationPoints(o.getValidationPoints() != null ? o.getValidationPoints() : g.getValidationPoints())
                .build();

        validate(resolved);
        return resolved;
    }

    public ResolvedConfig resolve(DetectionConfig global, String dimensionKey) {
        return resolve(global, global != null ? global.getPerDimensionOverrides() : null, dimensionKey);
    }

    /**
     * Range checks that need no series. The neighbour count is checked again
     * against the window length once the series is known.
     */
    void validate(ResolvedConfig c) {
        if (!(c.getContamination() > 0.0 && c.getContamination() <= 0.5)) {
            throw InvalidConfigException.invalidParameter("contamination", c.getContamination(), "a value in (0, 0.5]");
        }
        if (c.getNNeighbors() < 1) {
            throw InvalidConfigException.invalidParameter("n_neighbors", c.getNNeighbors(), ">= 1");
        }
        if (!(c.getPercentageThreshold() > 0.0)) {
            throw InvalidConfigException.invalidParameter("percentage_threshold", c.getPercentageThreshold(), "> 0");
        }
        if (!(c.getMinimumValueThreshold() >= 0.0)) {
            throw InvalidConfigException.invalidParameter("minimum_value_threshold", c.getMinimumValueThreshold(), ">= 0");
        }
        if (c.getMinContiguousAnomalies() < 1) {
            throw InvalidConfigException.invalidParameter("min_contiguous_anomalies", c.getMinContiguousAnomalies(), ">= 1");
        }
        if (Double.isNaN(c.getValleyThreshold())) {
            throw InvalidConfigException.invalidParameter("valley_threshold", c.getValleyThreshold(), "a number");
        }
        if (c.getReturnWindowHours() != null && !(c.getReturnWindowHours() > 0.0)) {
            throw InvalidConfigException.invalidParameter("return_window_hours", c.getReturnWindowHours(), "> 0");
        }
        if (c.getValidationPoints() != null && c.getValidationPoints() < 1) {
            throw InvalidConfigException.invalidParameter("validation_points", c.getValidationPoints(), ">= 1");
        }
    }

    private static <T> T pick(T override, T global, T fallback) {
        if (override != null) return override;
        if (global != null) return global;
        return fallback;
    }
}
