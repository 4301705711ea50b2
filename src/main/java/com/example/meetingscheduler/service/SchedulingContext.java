package com.example.meetingscheduler.service;

import com.example.meetingscheduler.disambiguation.DisambiguationState;
import com.example.meetingscheduler.domain.model.ConversationPhase;
import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.model.ParsedRequest;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.domain.model.TimeSlotCandidate;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one conversation has accumulated so far. Passed into every orchestrator call; the
 * orchestrator itself keeps nothing between calls.
 */
@Data
public class SchedulingContext {

    private ConversationPhase phase = ConversationPhase.IDLE;
    private DisambiguationState disambiguation = new DisambiguationState();
    private ParsedRequest request;
    private List<ParticipantIdentity> participants = new ArrayList<>();
    private List<TimeSlotCandidate> suggestedSlots = new ArrayList<>();
    private int durationMinutes;
    private MeetingDraft draft;

    /**
     * Drops everything tied to the current request. A draft that was already scheduled is kept.
     */
    public void clearPending() {
        disambiguation.reset();
        suggestedSlots = new ArrayList<>();
    }

    public void reset() {
        phase = ConversationPhase.IDLE;
        disambiguation = new DisambiguationState();
        request = null;
        participants = new ArrayList<>();
        suggestedSlots = new ArrayList<>();
        durationMinutes = 0;
        draft = null;
    }
}
