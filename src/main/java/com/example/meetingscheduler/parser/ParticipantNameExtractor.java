package com.example.meetingscheduler.parser;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Person names mentioned around conjunctions ("with X", "and X", "X and", ", X"), topped up with
 * well-known first names that appear anywhere in the text.
 */
class ParticipantNameExtractor implements FieldExtractor<List<String>> {

    // connectives match in any case, the name itself must be capitalised
    private static final String NAME = "([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*)";

    private static final List<Pattern> CONJUNCTION_PATTERNS = List.of(
            Pattern.compile("(?i:\\bwith)\\s+" + NAME),
            Pattern.compile("(?i:\\band)\\s+" + NAME),
            Pattern.compile(NAME + "\\s+(?i:and\\b)"),
            Pattern.compile(",\\s*" + NAME));

    static final Set<String> COMMON_FIRST_NAMES = Set.of(
            "John", "Jane", "Mike", "Sarah", "David", "Emily", "Chris", "Lisa",
            "James", "Maria", "Robert", "Jennifer", "Michael", "Amy", "Daniel",
            "Jessica", "Matthew", "Ashley", "Andrew", "Amanda");

    // capitalised words that show up next to connectives but are never people, including
    // sentence-initial verbs ("Meet John and ...")
    private static final Set<String> NOT_NAMES = Set.of(
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "january", "february", "march", "april", "may", "june", "july", "august",
            "september", "october", "november", "december",
            "today", "tomorrow", "yesterday", "next", "this", "morning", "afternoon", "evening", "noon",
            "team", "everyone", "meeting", "call", "sync", "review", "schedule", "book", "please", "set",
            "meet", "invite", "ask", "ping", "add", "arrange", "organize", "plan", "setup");

    @Override
    public List<String> extract(String text, LocalDate today) {
        Set<String> names = new LinkedHashSet<>();
        for (Pattern pattern : CONJUNCTION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String cleaned = dropNonNames(matcher.group(1));
                if (!cleaned.isEmpty()) {
                    names.add(cleaned);
                }
            }
        }

        Set<String> tokensInNames = names.stream()
                .flatMap(name -> Arrays.stream(name.split("\\s+")))
                .collect(Collectors.toSet());
        for (String word : text.split("\\s+")) {
            String token = word.replaceAll("[^A-Za-z]", "");
            if (COMMON_FIRST_NAMES.contains(token) && !tokensInNames.contains(token)) {
                names.add(token);
            }
        }
        return names.isEmpty() ? null : new ArrayList<>(names);
    }

    private static String dropNonNames(String candidate) {
        return Arrays.stream(candidate.trim().split("\\s+"))
                .filter(token -> !NOT_NAMES.contains(token.toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining(" "));
    }
}
