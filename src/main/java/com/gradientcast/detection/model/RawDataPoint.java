package com.gradientcast.detection.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One already-deserialized input point, as handed over by the transport layer.
 * The timestamp is still text and the value is whatever the payload carried;
 * both are validated by the window manager.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawDataPoint {

    // MM/DD/YYYY, HH:MM AM/PM
    private String timestamp;

    private Object value;

    public static RawDataPoint of(String timestamp, Object value) {
        return new RawDataPoint(timestamp, value);
    }
}
