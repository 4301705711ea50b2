package com.example.meetingscheduler.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class MeetingDraft {

    // assigned the first time the draft is scheduled and reused on every retry
    private String id;
    private String title;
    private String description;
    private List<ParticipantIdentity> participants = new ArrayList<>();
    private LocalDateTime startTime;
    private int durationMinutes = 60;
    private MeetingPriority priority = MeetingPriority.MEDIUM;
    private MeetingStatus status = MeetingStatus.DRAFT;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public LocalDateTime getEndTime() {
        return startTime == null ? null : startTime.plusMinutes(durationMinutes);
    }

    /**
     * Adds a participant unless one with the same email (ignoring case) is already present.
     */
    public boolean addParticipant(ParticipantIdentity participant) {
        boolean present = participants.stream()
                .anyMatch(p -> p.getEmail().equalsIgnoreCase(participant.getEmail()));
        if (present) {
            return false;
        }
        participants.add(participant);
        return true;
    }

    public List<String> participantEmails() {
        return participants.stream().map(ParticipantIdentity::getEmail).toList();
    }
}
