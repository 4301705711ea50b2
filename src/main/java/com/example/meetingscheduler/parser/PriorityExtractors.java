package com.example.meetingscheduler.parser;

import com.example.meetingscheduler.domain.model.MeetingPriority;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Keyword classes for priority. No match leaves the field empty; the medium default is applied
 * when the draft is built.
 */
final class PriorityExtractors {

    private static final Pattern URGENT = Pattern.compile("\\b(?:urgent|asap|immediately|critical)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HIGH = Pattern.compile("\\b(?:high\\s*priority|important)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOW = Pattern.compile("\\b(?:low|normal)\\s*priority\\b", Pattern.CASE_INSENSITIVE);

    private PriorityExtractors() {
    }

    static List<FieldExtractor<MeetingPriority>> ordered() {
        return List.of(
                keywordClass(URGENT, MeetingPriority.URGENT),
                keywordClass(HIGH, MeetingPriority.HIGH),
                keywordClass(LOW, MeetingPriority.LOW));
    }

    private static FieldExtractor<MeetingPriority> keywordClass(Pattern pattern, MeetingPriority priority) {
        return (text, today) -> pattern.matcher(text).find() ? priority : null;
    }
}
