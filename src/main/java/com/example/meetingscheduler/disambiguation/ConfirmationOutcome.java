package com.example.meetingscheduler.disambiguation;

import com.example.meetingscheduler.domain.model.ParsedRequest;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import lombok.Value;

import java.util.List;

@Value
public class ConfirmationOutcome {

    public enum Status {
        PENDING,
        FINALIZED
    }

    Status status;
    List<String> remainingQueries;
    List<ParticipantIdentity> participants;
    ParsedRequest request;

    static ConfirmationOutcome pending(List<String> remainingQueries) {
        return new ConfirmationOutcome(Status.PENDING, List.copyOf(remainingQueries), List.of(), null);
    }

    static ConfirmationOutcome finalized(List<ParticipantIdentity> participants, ParsedRequest request) {
        return new ConfirmationOutcome(Status.FINALIZED, List.of(), List.copyOf(participants), request);
    }

    public boolean isFinalized() {
        return status == Status.FINALIZED;
    }
}
