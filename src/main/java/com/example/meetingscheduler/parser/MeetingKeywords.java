package com.example.meetingscheduler.parser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Words that mark a request as being about a meeting, in lookup order.
 */
public final class MeetingKeywords {

    public static final List<String> ALL = List.of(
            "meeting", "call", "sync", "standup", "review", "discussion",
            "session", "presentation", "demo", "interview", "chat");

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        for (String keyword : ALL) {
            PATTERNS.put(keyword, Pattern.compile("\\b" + keyword + "\\b", Pattern.CASE_INSENSITIVE));
        }
    }

    private MeetingKeywords() {
    }

    public static long countIn(String text) {
        return PATTERNS.values().stream().filter(p -> p.matcher(text).find()).count();
    }

    public static boolean contains(String text, String keyword) {
        Pattern pattern = PATTERNS.get(keyword);
        return pattern != null && pattern.matcher(text).find();
    }
}
