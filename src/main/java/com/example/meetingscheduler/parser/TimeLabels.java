package com.example.meetingscheduler.parser;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * The "h:mm AM" labels produced by the parser and their conversion back to a clock time.
 */
public final class TimeLabels {

    private static final DateTimeFormatter TWELVE_HOUR = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final DateTimeFormatter TWENTY_FOUR_HOUR = DateTimeFormatter.ofPattern("H:mm", Locale.US);

    private TimeLabels() {
    }

    static String format(int hour, int minute, String period) {
        return String.format(Locale.ROOT, "%d:%02d %s", hour, minute, period);
    }

    public static String format(LocalTime time) {
        return time.format(TWELVE_HOUR);
    }

    /**
     * Parses "2:00 PM" or "14:00"; returns null for anything else.
     */
    public static LocalTime toLocalTime(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String trimmed = label.trim().toUpperCase(Locale.ROOT);
        try {
            if (trimmed.endsWith("AM") || trimmed.endsWith("PM")) {
                return LocalTime.parse(trimmed, TWELVE_HOUR);
            }
            return LocalTime.parse(trimmed, TWENTY_FOUR_HOUR);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
