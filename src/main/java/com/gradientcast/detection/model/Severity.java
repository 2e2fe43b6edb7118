package com.gradientcast.detection.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordinal classification of an anomaly's magnitude. Declaration order is the
 * severity order, so {@link #compareTo} ranks them.
 */
public enum Severity {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Bands are inclusive at their lower bound: 30 low, 50 medium, 70 high, 85 critical.
     */
    public static Severity fromScore(double normalizedScore) {
        if (normalizedScore >= 85) return CRITICAL;
        if (normalizedScore >= 70) return HIGH;
        if (normalizedScore >= 50) return MEDIUM;
        if (normalizedScore >= 30) return LOW;
        return NONE;
    }

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
