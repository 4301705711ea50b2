package com.example.meetingscheduler.parser;

import com.example.meetingscheduler.domain.model.MeetingPriority;
import com.example.meetingscheduler.domain.model.ParsedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Turns a free-form meeting request into a {@link ParsedRequest}.
 *
 * <p>Each field is extracted by its own {@link ExtractorChain}; a field whose strategies all come
 * back empty (or throw) is simply left null. The parser itself never throws for non-null input.
 */
public class RequestParser {

    private static final Logger logger = LoggerFactory.getLogger(RequestParser.class);

    static final int MIN_DESCRIPTION_LENGTH = 20;

    private final Clock clock;

    private final ExtractorChain<List<String>> emails =
            new ExtractorChain<>("participantEmails", List.of(new EmailExtractor()));
    private final ExtractorChain<List<String>> names =
            new ExtractorChain<>("participantNames", List.of(new ParticipantNameExtractor()));
    private final ExtractorChain<LocalDate> dates = new ExtractorChain<>("date", DateExtractors.ordered());
    private final ExtractorChain<String> times = new ExtractorChain<>("time", TimeExtractors.ordered());
    private final ExtractorChain<String> durations = new ExtractorChain<>("duration", DurationExtractors.ordered());
    private final ExtractorChain<MeetingPriority> priorities =
            new ExtractorChain<>("priority", PriorityExtractors.ordered());
    private final ExtractorChain<String> titles = new ExtractorChain<>("title", TitleExtractors.ordered());
    private final ExtractorChain<String> descriptions = new ExtractorChain<>("description",
            List.of((text, today) -> text.trim().length() > MIN_DESCRIPTION_LENGTH ? text.trim() : null));

    public RequestParser(Clock clock) {
        this.clock = clock;
    }

    public ParsedRequest parse(String text) {
        return parse(text, LocalDate.now(clock));
    }

    public ParsedRequest parse(String text, LocalDate today) {
        String input = text == null ? "" : text;
        if (input.isBlank()) {
            return ParsedRequest.builder().originalText(input).confidence(0.0).build();
        }

        List<String> foundEmails = emails.firstMatch(input, today);
        List<String> foundNames = names.firstMatch(input, today);
        ParsedRequest parsed = ParsedRequest.builder()
                .originalText(input)
                .participantEmails(foundEmails == null ? List.of() : List.copyOf(foundEmails))
                .participantNames(foundNames == null ? List.of() : List.copyOf(foundNames))
                .dateMentioned(dates.firstMatch(input, today))
                .timeMentioned(times.firstMatch(input, today))
                .durationMentioned(durations.firstMatch(input, today))
                .priorityMentioned(priorities.firstMatch(input, today))
                .title(titles.firstMatch(input, today))
                .description(descriptions.firstMatch(input, today))
                .build();

        double confidence;
        try {
            confidence = ConfidenceScorer.score(parsed);
        } catch (RuntimeException e) {
            logger.warn("Confidence scoring failed for '{}', using floor value: {}", input, e.getMessage());
            confidence = ConfidenceScorer.FLOOR;
        }
        ParsedRequest result = parsed.toBuilder().confidence(confidence).build();
        logger.debug("Parsed request: {}", result);
        return result;
    }
}
