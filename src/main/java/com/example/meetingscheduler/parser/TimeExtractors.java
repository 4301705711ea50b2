package com.example.meetingscheduler.parser;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Clock-time rules. Every rule renders a 12-hour label such as "2:00 PM"; values outside the
 * valid range are skipped rather than coerced.
 */
final class TimeExtractors {

    private static final Pattern HOUR_MINUTE_PERIOD =
            Pattern.compile("\\b(\\d{1,2}):(\\d{2})\\s*(am|pm)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOUR_PERIOD =
            Pattern.compile("\\b(\\d{1,2})\\s*(am|pm)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TWENTY_FOUR_HOUR =
            Pattern.compile("\\b(\\d{1,2}):(\\d{2})\\b");

    private TimeExtractors() {
    }

    static List<FieldExtractor<String>> ordered() {
        return List.of(
                TimeExtractors::hourMinuteWithPeriod,
                TimeExtractors::hourWithPeriod,
                TimeExtractors::twentyFourHour);
    }

    static String hourMinuteWithPeriod(String text, LocalDate today) {
        Matcher matcher = HOUR_MINUTE_PERIOD.matcher(text);
        while (matcher.find()) {
            int hour = Integer.parseInt(matcher.group(1));
            int minute = Integer.parseInt(matcher.group(2));
            if (hour >= 1 && hour <= 12 && minute <= 59) {
                return TimeLabels.format(hour, minute, matcher.group(3).toUpperCase(Locale.ROOT));
            }
        }
        return null;
    }

    static String hourWithPeriod(String text, LocalDate today) {
        Matcher matcher = HOUR_PERIOD.matcher(text);
        while (matcher.find()) {
            int hour = Integer.parseInt(matcher.group(1));
            if (hour >= 1 && hour <= 12) {
                return TimeLabels.format(hour, 0, matcher.group(2).toUpperCase(Locale.ROOT));
            }
        }
        return null;
    }

    static String twentyFourHour(String text, LocalDate today) {
        Matcher matcher = TWENTY_FOUR_HOUR.matcher(text);
        while (matcher.find()) {
            int hour = Integer.parseInt(matcher.group(1));
            int minute = Integer.parseInt(matcher.group(2));
            if (hour > 23 || minute > 59) {
                continue;
            }
            if (hour == 0) {
                return TimeLabels.format(12, minute, "AM");
            } else if (hour < 12) {
                return TimeLabels.format(hour, minute, "AM");
            } else if (hour == 12) {
                return TimeLabels.format(12, minute, "PM");
            }
            return TimeLabels.format(hour - 12, minute, "PM");
        }
        return null;
    }
}
