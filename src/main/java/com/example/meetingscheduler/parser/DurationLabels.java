package com.example.meetingscheduler.parser;

import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical duration labels. Minutes without a canonical label render as "&lt;n&gt; minutes".
 */
public final class DurationLabels {

    private static final Map<Integer, String> CANONICAL = Map.of(
            15, "15 minutes",
            30, "30 minutes",
            45, "45 minutes",
            60, "1 hour",
            90, "1.5 hours",
            120, "2 hours",
            150, "2.5 hours",
            180, "3 hours");

    private static final Pattern LABEL = Pattern.compile("^(\\d+(?:\\.\\d+)?) (minutes|hours?)$");

    private DurationLabels() {
    }

    public static String label(int minutes) {
        return CANONICAL.getOrDefault(minutes, minutes + " minutes");
    }

    public static OptionalInt toMinutes(String label) {
        if (label == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = LABEL.matcher(label.trim());
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        double amount = Double.parseDouble(matcher.group(1));
        int minutes = matcher.group(2).startsWith("hour") ? (int) Math.round(amount * 60) : (int) amount;
        return minutes > 0 ? OptionalInt.of(minutes) : OptionalInt.empty();
    }
}
