package com.example.meetingscheduler.service;

import com.example.meetingscheduler.config.SchedulingProperties;
import com.example.meetingscheduler.config.TemporalProperties;
import com.example.meetingscheduler.domain.model.ConversationPhase;
import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.payload.AssistantReply;
import com.example.meetingscheduler.workflow.ConversationStart;
import com.example.meetingscheduler.workflow.MeetingSchedulingWorkflow;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Starts conversation workflows and relays user actions to them as signals.
 */
@Service
public class ConversationGateway {

    private static final Logger logger = LoggerFactory.getLogger(ConversationGateway.class);

    public static final String WORKFLOW_ID_PREFIX = "MeetingConversation_";

    private final WorkflowClient workflowClient;
    private final TemporalProperties temporalProperties;
    private final SchedulingProperties schedulingProperties;

    public ConversationGateway(WorkflowClient workflowClient,
                               TemporalProperties temporalProperties,
                               SchedulingProperties schedulingProperties) {
        this.workflowClient = workflowClient;
        this.temporalProperties = temporalProperties;
        this.schedulingProperties = schedulingProperties;
    }

    /**
     * @return the id of the new conversation
     */
    public String startConversation(String initialMessage) {
        String workflowId = WORKFLOW_ID_PREFIX + UUID.randomUUID().toString().substring(0, 8);
        MeetingSchedulingWorkflow workflow = workflowClient.newWorkflowStub(
                MeetingSchedulingWorkflow.class,
                WorkflowOptions.newBuilder()
                        .setWorkflowId(workflowId)
                        .setTaskQueue(temporalProperties.getTaskQueue())
                        .build());
        ConversationStart start = new ConversationStart(initialMessage, schedulingProperties,
                temporalProperties.getIdleTimeoutMinutes());
        WorkflowClient.start(workflow::converse, start);
        logger.info("Started conversation {}", workflowId);
        return workflowId;
    }

    public void sendMessage(String conversationId, String text) {
        stub(conversationId).submitMessage(text);
    }

    public void confirmParticipant(String conversationId, String query, String email) {
        stub(conversationId).confirmParticipant(query, email);
    }

    public void addExternalParticipant(String conversationId, String query, String email) {
        stub(conversationId).addExternalParticipant(query, email);
    }

    public void selectSlot(String conversationId, int index) {
        stub(conversationId).selectSlot(index);
    }

    public void scheduleMeeting(String conversationId) {
        stub(conversationId).scheduleMeeting();
    }

    public void changeTime(String conversationId) {
        stub(conversationId).changeTime();
    }

    public void cancel(String conversationId) {
        stub(conversationId).cancel();
    }

    public AssistantReply latestReply(String conversationId) {
        return stub(conversationId).getLatestReply();
    }

    public ConversationPhase phase(String conversationId) {
        return stub(conversationId).getPhase();
    }

    public MeetingDraft draft(String conversationId) {
        return stub(conversationId).getDraft();
    }

    private MeetingSchedulingWorkflow stub(String conversationId) {
        return workflowClient.newWorkflowStub(MeetingSchedulingWorkflow.class, conversationId);
    }
}
