package com.example.meetingscheduler.domain.payload;

public enum ReplyType {
    NOT_UNDERSTOOD,
    NEEDS_PARTICIPANTS,
    PARTICIPANTS_NEED_CONFIRMATION,
    PARTICIPANT_CONFIRMED,
    SLOT_SUGGESTIONS,
    NO_AVAILABILITY,
    DRAFT_READY,
    SCHEDULED,
    STORE_FAILURE,
    CANCELLED,
    VALIDATION_ERROR,
    NOTHING_PENDING
}
