package com.example.meetingscheduler.domain.payload;

import com.example.meetingscheduler.domain.model.TimeSlotCandidate;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class TimeSlotSuggestionsPayload implements AssistantPayload {
    private List<TimeSlotCandidate> slots = new ArrayList<>();
    // size of the full candidate list, slots holds only the preview
    private int totalSlots;
    private List<String> conflictingParticipants = new ArrayList<>();
    private String conflictMessage;
}
