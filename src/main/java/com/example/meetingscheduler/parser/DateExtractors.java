package com.example.meetingscheduler.parser;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date rules in precedence order; the first one that produces a date wins.
 */
final class DateExtractors {

    private static final String WEEKDAYS = "monday|tuesday|wednesday|thursday|friday|saturday|sunday";
    private static final String MONTHS = "january|february|march|april|may|june|july|august|september|october|november|december";

    private static final Pattern RELATIVE = Pattern.compile("\\b(today|tomorrow|yesterday)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_WEEKDAY =
            Pattern.compile("(?<!\\b(?:next|this)\\s)\\b(" + WEEKDAYS + ")\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUALIFIED_WEEKDAY =
            Pattern.compile("\\b(?:next|this)\\s+(" + WEEKDAYS + ")\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY =
            Pattern.compile("\\b(" + MONTHS + ")\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b", Pattern.CASE_INSENSITIVE);
    // "1/2 an hour" and "10-15 minute" are durations, not dates
    private static final Pattern NUMERIC =
            Pattern.compile("\\b(\\d{1,2})[/-](\\d{1,2})(?:[/-](\\d{4}|\\d{2}))?\\b"
                            + "(?!\\s*(?:an?\\s+)?(?:hours?|hrs?|minutes?|mins?)\\b)",
                    Pattern.CASE_INSENSITIVE);

    private DateExtractors() {
    }

    static List<FieldExtractor<LocalDate>> ordered() {
        return List.of(
                DateExtractors::relativeKeyword,
                DateExtractors::bareWeekday,
                DateExtractors::qualifiedWeekday,
                DateExtractors::monthAndDay,
                DateExtractors::numeric);
    }

    static LocalDate relativeKeyword(String text, LocalDate today) {
        Matcher matcher = RELATIVE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return switch (matcher.group(1).toLowerCase(Locale.ROOT)) {
            case "tomorrow" -> today.plusDays(1);
            case "yesterday" -> today.minusDays(1);
            default -> today;
        };
    }

    static LocalDate bareWeekday(String text, LocalDate today) {
        Matcher matcher = BARE_WEEKDAY.matcher(text);
        return matcher.find() ? nextOccurrence(today, matcher.group(1)) : null;
    }

    static LocalDate qualifiedWeekday(String text, LocalDate today) {
        Matcher matcher = QUALIFIED_WEEKDAY.matcher(text);
        return matcher.find() ? nextOccurrence(today, matcher.group(1)) : null;
    }

    static LocalDate monthAndDay(String text, LocalDate today) {
        Matcher matcher = MONTH_DAY.matcher(text);
        while (matcher.find()) {
            int month = Month.valueOf(matcher.group(1).toUpperCase(Locale.ROOT)).getValue();
            int day = Integer.parseInt(matcher.group(2));
            int year = today.getYear();
            if (month < today.getMonthValue() || (month == today.getMonthValue() && day < today.getDayOfMonth())) {
                year++;
            }
            LocalDate date = safeDate(year, month, day);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    static LocalDate numeric(String text, LocalDate today) {
        Matcher matcher = NUMERIC.matcher(text);
        while (matcher.find()) {
            int month = Integer.parseInt(matcher.group(1));
            int day = Integer.parseInt(matcher.group(2));
            int year = today.getYear();
            if (matcher.group(3) != null) {
                year = Integer.parseInt(matcher.group(3));
                if (year < 100) {
                    year += 2000;
                }
            }
            LocalDate date = safeDate(year, month, day);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    /**
     * Next date falling on the named weekday, strictly after today.
     */
    private static LocalDate nextOccurrence(LocalDate today, String weekdayName) {
        DayOfWeek target = DayOfWeek.valueOf(weekdayName.toUpperCase(Locale.ROOT));
        int daysAhead = target.getValue() - today.getDayOfWeek().getValue();
        if (daysAhead <= 0) {
            daysAhead += 7;
        }
        return today.plusDays(daysAhead);
    }

    private static LocalDate safeDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
