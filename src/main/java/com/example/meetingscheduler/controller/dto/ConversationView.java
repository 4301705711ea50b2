package com.example.meetingscheduler.controller.dto;

import com.example.meetingscheduler.domain.model.ConversationPhase;
import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.payload.AssistantReply;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationView {
    private String conversationId;
    private ConversationPhase phase;
    private AssistantReply reply;
    private MeetingDraft draft;
}
