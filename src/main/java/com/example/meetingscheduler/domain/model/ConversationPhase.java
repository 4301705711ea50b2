package com.example.meetingscheduler.domain.model;

/**
 * Where a conversation currently sits. The two AWAITING_* phases before a draft exists are the
 * points where processing is suspended until the user makes a choice.
 */
public enum ConversationPhase {
    IDLE,
    AWAITING_PARTICIPANTS,
    AWAITING_SLOT_SELECTION,
    AWAITING_CONFIRMATION,
    SCHEDULED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SCHEDULED || this == CANCELLED;
    }
}
