package com.example.meetingscheduler.workflow;

import com.example.meetingscheduler.config.SchedulingProperties;
import com.example.meetingscheduler.config.TemporalConfig;
import com.example.meetingscheduler.domain.model.ConversationPhase;
import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.model.MeetingStatus;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.domain.payload.AssistantReply;
import com.example.meetingscheduler.domain.payload.ParticipantMatchesPayload;
import com.example.meetingscheduler.domain.payload.ReplyType;
import com.example.meetingscheduler.exception.StoreFailureException;
import com.example.meetingscheduler.integration.calendar.InMemoryCalendarProvider;
import com.example.meetingscheduler.integration.directory.InMemoryParticipantDirectory;
import com.example.meetingscheduler.service.MeetingStore;
import com.example.meetingscheduler.workflow.activity.impl.AvailabilityActivityImpl;
import com.example.meetingscheduler.workflow.activity.impl.DirectoryActivityImpl;
import com.example.meetingscheduler.workflow.activity.impl.MeetingStoreActivityImpl;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import io.temporal.testing.TestWorkflowEnvironment;
import io.temporal.testing.TestWorkflowExtension;
import io.temporal.worker.Worker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class MeetingSchedulingWorkflowTest {

    private static final Logger logger = LoggerFactory.getLogger(MeetingSchedulingWorkflowTest.class);

    private static final long QUERY_TIMEOUT_MILLIS = 10_000;

    @RegisterExtension
    public static final TestWorkflowExtension testWorkflowExtension =
            TestWorkflowExtension.newBuilder()
                    .setWorkflowTypes(MeetingSchedulingWorkflowImpl.class)
                    .setDoNotStart(true) // started in setUp once the activities are registered
                    .setWorkflowClientOptions(WorkflowClientOptions.newBuilder()
                            .setDataConverter(TemporalConfig.dataConverter())
                            .build())
                    .build();

    private MeetingStore meetingStore;
    private WorkflowClient workflowClient;
    private String taskQueue;

    @BeforeEach
    public void setUp(TestWorkflowEnvironment testEnv) {
        taskQueue = "Test-" + UUID.randomUUID();

        InMemoryParticipantDirectory directory = new InMemoryParticipantDirectory(List.of(
                ParticipantIdentity.of("john.smith@company.com", "John Smith"),
                ParticipantIdentity.of("john.brown@company.com", "John Brown"),
                ParticipantIdentity.of("sarah.johnson@company.com", "Sarah Johnson")));
        InMemoryCalendarProvider calendar = new InMemoryCalendarProvider(directory, List.of());
        meetingStore = mock(MeetingStore.class);

        Worker worker = testEnv.getWorkerFactory().newWorker(taskQueue);
        worker.registerWorkflowImplementationTypes(MeetingSchedulingWorkflowImpl.class);
        worker.registerActivitiesImplementations(
                new DirectoryActivityImpl(directory),
                new AvailabilityActivityImpl(calendar),
                new MeetingStoreActivityImpl(meetingStore));

        testEnv.start();
        workflowClient = testEnv.getWorkflowClient();
    }

    private MeetingSchedulingWorkflow newConversation(String initialMessage, long idleTimeoutMinutes) {
        MeetingSchedulingWorkflow workflow = workflowClient.newWorkflowStub(
                MeetingSchedulingWorkflow.class,
                WorkflowOptions.newBuilder()
                        .setWorkflowId("MeetingConversation_" + UUID.randomUUID())
                        .setTaskQueue(taskQueue)
                        .build());
        WorkflowClient.start(workflow::converse,
                new ConversationStart(initialMessage, new SchedulingProperties(), idleTimeoutMinutes));
        return workflow;
    }

    /**
     * Polls the reply query until it reports {@code expected}. Signals are handled asynchronously.
     */
    private static AssistantReply awaitReply(MeetingSchedulingWorkflow workflow, ReplyType expected)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + QUERY_TIMEOUT_MILLIS;
        AssistantReply reply = null;
        while (System.currentTimeMillis() < deadline) {
            reply = workflow.getLatestReply();
            if (reply != null && reply.getType() == expected) {
                return reply;
            }
            Thread.sleep(50);
        }
        fail("Expected a " + expected + " reply but the latest was " + (reply == null ? "none" : reply.getType()));
        return null;
    }

    @Test
    public void testKnownEmailIsScheduledEndToEnd() throws Exception {
        MeetingSchedulingWorkflow workflow = newConversation(
                "Schedule a meeting with john.smith@company.com tomorrow at 2pm for 1 hour", 30);

        awaitReply(workflow, ReplyType.DRAFT_READY);
        assertEquals(ConversationPhase.AWAITING_CONFIRMATION, workflow.getPhase());
        MeetingDraft draft = workflow.getDraft();
        assertEquals(14, draft.getStartTime().getHour());
        assertEquals(60, draft.getDurationMinutes());
        assertEquals(List.of("john.smith@company.com"), draft.participantEmails());

        workflow.scheduleMeeting();

        MeetingDraft result = WorkflowStub.fromTyped(workflow).getResult(MeetingDraft.class);
        assertEquals(MeetingStatus.SCHEDULED, result.getStatus());
        assertTrue(result.getId().matches("MTG_[0-9A-F]{12}"), result.getId());

        ArgumentCaptor<MeetingDraft> stored = ArgumentCaptor.forClass(MeetingDraft.class);
        verify(meetingStore, times(1)).save(stored.capture());
        assertEquals(result.getId(), stored.getValue().getId());
        logger.info("Scheduled meeting {}", result.getId());
    }

    @Test
    public void testAmbiguousNameIsConfirmedBySignal() throws Exception {
        MeetingSchedulingWorkflow workflow = newConversation(null, 30);

        workflow.submitMessage("Meeting with John tomorrow at 3pm");

        AssistantReply question = awaitReply(workflow, ReplyType.PARTICIPANTS_NEED_CONFIRMATION);
        assertEquals(ConversationPhase.AWAITING_PARTICIPANTS, workflow.getPhase());
        ParticipantMatchesPayload matches = question.payload(ParticipantMatchesPayload.class).orElseThrow();
        assertEquals("John", matches.getPrompts().get(0).getQuery());
        assertEquals(2, matches.getPrompts().get(0).getOptions().size());

        workflow.confirmParticipant("John", "john.brown@company.com");

        awaitReply(workflow, ReplyType.DRAFT_READY);
        assertEquals(List.of("john.brown@company.com"), workflow.getDraft().participantEmails());

        workflow.cancel();

        MeetingDraft result = WorkflowStub.fromTyped(workflow).getResult(MeetingDraft.class);
        assertEquals(MeetingStatus.CANCELLED, result.getStatus());
        verifyNoInteractions(meetingStore);
    }

    @Test
    public void testStoreFailureCanBeRetried() throws Exception {
        doThrow(new StoreFailureException(null, "database unavailable"))
                .doNothing()
                .when(meetingStore).save(any(MeetingDraft.class));
        MeetingSchedulingWorkflow workflow = newConversation(
                "Schedule a meeting with john.smith@company.com tomorrow at 2pm for 1 hour", 30);
        awaitReply(workflow, ReplyType.DRAFT_READY);

        workflow.scheduleMeeting();

        awaitReply(workflow, ReplyType.STORE_FAILURE);
        assertEquals(ConversationPhase.AWAITING_CONFIRMATION, workflow.getPhase());
        String draftId = workflow.getDraft().getId();
        assertNotNull(draftId);

        workflow.scheduleMeeting();

        MeetingDraft result = WorkflowStub.fromTyped(workflow).getResult(MeetingDraft.class);
        assertEquals(draftId, result.getId());
        assertEquals(MeetingStatus.SCHEDULED, result.getStatus());
        verify(meetingStore, times(2)).save(any(MeetingDraft.class));
    }

    @Test
    public void testMessageWhileAwaitingChoiceIsRejected() throws Exception {
        MeetingSchedulingWorkflow workflow = newConversation("Meeting with John tomorrow at 3pm", 30);
        awaitReply(workflow, ReplyType.PARTICIPANTS_NEED_CONFIRMATION);

        workflow.submitMessage("Meeting with Sarah Johnson tomorrow at 4pm");

        awaitReply(workflow, ReplyType.VALIDATION_ERROR);
        assertEquals(ConversationPhase.AWAITING_PARTICIPANTS, workflow.getPhase());
        workflow.cancel();
        WorkflowStub.fromTyped(workflow).getResult(MeetingDraft.class);
    }

    @Test
    public void testIdleConversationIsClosed(TestWorkflowEnvironment testEnv) {
        long startedAt = testEnv.currentTimeMillis();
        MeetingSchedulingWorkflow workflow = newConversation(null, 5);

        // no signal arrives, so waiting for the result lets the idle timer fire
        MeetingDraft result = WorkflowStub.fromTyped(workflow).getResult(MeetingDraft.class);

        assertNull(result);
        assertTrue(testEnv.currentTimeMillis() - startedAt >= Duration.ofMinutes(5).toMillis());
        verifyNoInteractions(meetingStore);
    }
}
