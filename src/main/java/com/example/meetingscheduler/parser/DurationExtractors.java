package com.example.meetingscheduler.parser;

import java.time.LocalDate;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class DurationExtractors {

    // a number glued to '/' or '.' on its left belongs to a fraction such as "1/2 hour"
    private static final String AMOUNT = "(?<![\\d/.])(\\d+(?:\\.\\d+)?)";

    private static final Pattern HOURS_AND_MINUTES = Pattern.compile(
            AMOUNT + "\\s*(?:hours?|hrs?)\\s*(?:and\\s+)?(\\d+)\\s*(?:minutes?|mins?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOURS = Pattern.compile(
            AMOUNT + "\\s*(?:hours?|hrs?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MINUTES = Pattern.compile(
            "(?<![\\d/.])(\\d+)\\s*(?:minutes?|mins?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HALF_HOUR = Pattern.compile(
            "\\b(?:half|1/2)\\s*(?:an?\\s+)?hour\\b", Pattern.CASE_INSENSITIVE);

    private DurationExtractors() {
    }

    static List<FieldExtractor<String>> ordered() {
        return List.of(
                DurationExtractors::hoursAndMinutes,
                DurationExtractors::hours,
                DurationExtractors::minutes,
                DurationExtractors::halfHour);
    }

    static String hoursAndMinutes(String text, LocalDate today) {
        Matcher matcher = HOURS_AND_MINUTES.matcher(text);
        while (matcher.find()) {
            int total = (int) Math.round(Double.parseDouble(matcher.group(1)) * 60) + Integer.parseInt(matcher.group(2));
            if (total > 0) {
                return DurationLabels.label(total);
            }
        }
        return null;
    }

    static String hours(String text, LocalDate today) {
        Matcher matcher = HOURS.matcher(text);
        while (matcher.find()) {
            int total = (int) Math.round(Double.parseDouble(matcher.group(1)) * 60);
            if (total > 0) {
                return DurationLabels.label(total);
            }
        }
        return null;
    }

    static String minutes(String text, LocalDate today) {
        Matcher matcher = MINUTES.matcher(text);
        while (matcher.find()) {
            int total = Integer.parseInt(matcher.group(1));
            if (total > 0) {
                return DurationLabels.label(total);
            }
        }
        return null;
    }

    static String halfHour(String text, LocalDate today) {
        return HALF_HOUR.matcher(text).find() ? DurationLabels.label(30) : null;
    }
}
