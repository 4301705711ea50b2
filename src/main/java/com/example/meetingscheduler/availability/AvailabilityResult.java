package com.example.meetingscheduler.availability;

import com.example.meetingscheduler.domain.model.TimeSlotCandidate;
import lombok.Value;

import java.util.List;

@Value
public class AvailabilityResult {

    public enum Outcome {
        /** The requested window works for everyone. */
        ACCEPTED,
        /** The requested window does not work; {@code alternatives} may be empty. */
        CONFLICT,
        /** No time was requested; {@code alternatives} lists what is free. */
        SUGGESTIONS
    }

    Outcome outcome;
    TimeSlotCandidate acceptedSlot;
    List<String> conflictingParticipants;
    List<TimeSlotCandidate> alternatives;

    static AvailabilityResult accepted(TimeSlotCandidate slot) {
        return new AvailabilityResult(Outcome.ACCEPTED, slot, List.of(), List.of());
    }

    static AvailabilityResult conflict(List<String> conflicting, List<TimeSlotCandidate> alternatives) {
        return new AvailabilityResult(Outcome.CONFLICT, null, List.copyOf(conflicting), List.copyOf(alternatives));
    }

    static AvailabilityResult suggestions(List<TimeSlotCandidate> slots) {
        return new AvailabilityResult(Outcome.SUGGESTIONS, null, List.of(), List.copyOf(slots));
    }

    public boolean hasAlternatives() {
        return !alternatives.isEmpty();
    }
}
