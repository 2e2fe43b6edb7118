package com.gradientcast.detection.engine;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * Codec for the wire timestamp pattern {@code MM/DD/YYYY, HH:MM AM/PM},
 * e.g. {@code 03/14/2024, 01:00 PM}.
 */
public final class TimestampFormat {

    public static final String PATTERN = "MM/dd/uuuu, hh:mm a";

    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(PATTERN)
            .toFormatter(Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);

    private TimestampFormat() {}

    /**
     * @throws java.time.format.DateTimeParseException when the text does not match the pattern
     */
    public static LocalDateTime parse(String text) {
        return LocalDateTime.parse(text.trim(), FORMATTER);
    }

    public static String format(LocalDateTime timestamp) {
        return FORMATTER.format(timestamp);
    }
}
