package com.example.meetingscheduler.parser;

import com.example.meetingscheduler.util.TextCase;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class TitleExtractors {

    private static final Pattern QUOTED = Pattern.compile("[\"\u201C]([^\"\u201D]*)[\"\u201D]");
    private static final int MIN_KEYWORD_TITLE_LENGTH = 5;
    private static final int FALLBACK_WORDS = 5;

    private TitleExtractors() {
    }

    static List<FieldExtractor<String>> ordered() {
        return List.of(
                TitleExtractors::quoted,
                TitleExtractors::aroundKeyword,
                TitleExtractors::leadingWords);
    }

    static String quoted(String text, LocalDate today) {
        Matcher matcher = QUOTED.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group(1).trim();
            if (!candidate.isEmpty()) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * The keyword plus one word either side, e.g. "a design review with" for "review".
     */
    static String aroundKeyword(String text, LocalDate today) {
        for (String keyword : MeetingKeywords.ALL) {
            if (!MeetingKeywords.contains(text, keyword)) {
                continue;
            }
            Pattern window = Pattern.compile("(?:\\w+\\s+)?\\b" + keyword + "\\b(?:\\s+\\w+)?", Pattern.CASE_INSENSITIVE);
            Matcher matcher = window.matcher(text);
            if (matcher.find()) {
                String title = matcher.group().trim();
                if (title.length() > MIN_KEYWORD_TITLE_LENGTH) {
                    return TextCase.titleCase(title);
                }
            }
        }
        return null;
    }

    static String leadingWords(String text, LocalDate today) {
        String[] words = text.trim().split("\\s+");
        if (words.length < 2) {
            return null;
        }
        String[] leading = Arrays.copyOf(words, Math.min(words.length, FALLBACK_WORDS));
        return TextCase.titleCase(String.join(" ", leading));
    }
}
