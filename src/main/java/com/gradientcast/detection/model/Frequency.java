package com.gradientcast.detection.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gradientcast.detection.exception.InvalidConfigException;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

/**
 * Sampling frequency codes accepted in configuration.
 */
public enum Frequency {
    HOURLY("H"),
    MINUTELY("T"),
    DAILY("D"),
    BUSINESS_DAILY("B"),
    WEEKLY("W"),
    MONTHLY("M"),
    QUARTERLY("Q"),
    YEARLY("Y");

    private final String code;

    Frequency(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Frequency fromCode(String code) {
        if (code != null) {
            for (Frequency frequency : values()) {
                if (frequency.code.equalsIgnoreCase(code.trim())) {
                    return frequency;
                }
            }
        }
        throw InvalidConfigException.invalidParameter("frequency", code, "one of H/T/D/B/W/M/Q/Y");
    }

    /**
     * The timestamp one step after {@code from}.
     */
    public LocalDateTime next(LocalDateTime from) {
        switch (this) {
            case HOURLY:
                return from.plusHours(1);
            case MINUTELY:
                return from.plusMinutes(1);
            case DAILY:
                return from.plusDays(1);
            case BUSINESS_DAILY:
                LocalDateTime next = from.plusDays(1);
                while (next.getDayOfWeek() == DayOfWeek.SATURDAY || next.getDayOfWeek() == DayOfWeek.SUNDAY) {
                    next = next.plusDays(1);
                }
                return next;
            case WEEKLY:
                return from.plusWeeks(1);
            case MONTHLY:
                return from.plusMonths(1);
            case QUARTERLY:
                return from.plusMonths(3);
            case YEARLY:
                return from.plusYears(1);
            default:
                throw new IllegalStateException("Unhandled frequency " + this);
        }
    }
}
