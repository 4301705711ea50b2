package com.example.meetingscheduler.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Structured reading of one free-form meeting request. Produced once per utterance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ParsedRequest {

    String originalText;
    String title;
    @Builder.Default
    List<String> participantNames = List.of();
    @Builder.Default
    List<String> participantEmails = List.of();
    LocalDate dateMentioned;
    String timeMentioned;
    String durationMentioned;
    MeetingPriority priorityMentioned;
    String description;
    double confidence;

    public boolean isUnderstood(double minimumConfidence) {
        return confidence >= minimumConfidence;
    }

    public boolean hasParticipantQueries() {
        return !participantNames.isEmpty() || !participantEmails.isEmpty();
    }
}
