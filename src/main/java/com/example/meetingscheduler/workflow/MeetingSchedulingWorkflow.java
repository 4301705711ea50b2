package com.example.meetingscheduler.workflow;

import com.example.meetingscheduler.domain.model.ConversationPhase;
import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.payload.AssistantReply;
import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.SignalMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * One scheduling conversation. Returns the final draft, or null if none was produced.
 */
@WorkflowInterface
public interface MeetingSchedulingWorkflow {

    @WorkflowMethod
    MeetingDraft converse(ConversationStart start);

    @SignalMethod
    void submitMessage(String text);

    @SignalMethod
    void confirmParticipant(String query, String email);

    @SignalMethod
    void addExternalParticipant(String query, String email);

    @SignalMethod
    void selectSlot(int index);

    @SignalMethod
    void scheduleMeeting();

    @SignalMethod
    void changeTime();

    @SignalMethod
    void cancel();

    @QueryMethod
    AssistantReply getLatestReply();

    @QueryMethod
    ConversationPhase getPhase();

    @QueryMethod
    MeetingDraft getDraft();
}
