package com.example.meetingscheduler.domain.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed data attached to an assistant reply for the front end to render.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ParticipantMatchesPayload.class, name = "participant_matches"),
        @JsonSubTypes.Type(value = MeetingSummaryPayload.class, name = "meeting_summary"),
        @JsonSubTypes.Type(value = TimeSlotSuggestionsPayload.class, name = "time_slot_suggestions"),
        @JsonSubTypes.Type(value = ConfirmationRequestPayload.class, name = "confirmation_request")
})
public interface AssistantPayload {
}
