package com.example.meetingscheduler.parser;

import com.example.meetingscheduler.domain.model.ParsedRequest;

/**
 * Additive confidence for a parsed request. Each recognised field contributes a fixed weight and
 * meeting keywords add a capped bonus; the sum is clamped to [0, 1].
 */
public final class ConfidenceScorer {

    static final double BASE = 0.1;
    static final double PARTICIPANTS = 0.3;
    static final double DATE = 0.2;
    static final double TIME = 0.2;
    static final double DURATION = 0.1;
    static final double TITLE = 0.1;
    static final double PER_KEYWORD = 0.05;
    static final double KEYWORD_CAP = 0.15;

    /** Score assigned when scoring itself blows up. */
    public static final double FLOOR = 0.1;

    private ConfidenceScorer() {
    }

    public static double score(ParsedRequest parsed) {
        String text = parsed.getOriginalText();
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        double score = BASE;
        if (!parsed.getParticipantNames().isEmpty() || !parsed.getParticipantEmails().isEmpty()) {
            score += PARTICIPANTS;
        }
        if (parsed.getDateMentioned() != null) {
            score += DATE;
        }
        if (parsed.getTimeMentioned() != null) {
            score += TIME;
        }
        if (parsed.getDurationMentioned() != null) {
            score += DURATION;
        }
        if (parsed.getTitle() != null) {
            score += TITLE;
        }
        score += Math.min(PER_KEYWORD * MeetingKeywords.countIn(text), KEYWORD_CAP);
        return clamp(score);
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
