package com.example.meetingscheduler.domain.payload;

import com.example.meetingscheduler.domain.model.MeetingDraft;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class MeetingSummaryPayload implements AssistantPayload {
    private MeetingDraft meeting;
}
