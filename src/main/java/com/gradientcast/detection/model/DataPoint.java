package com.gradientcast.detection.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * A validated point: parsed timestamp and value coerced to double.
 */
@Value
public class DataPoint {
    LocalDateTime timestamp;
    double value;
}
