package com.example.meetingscheduler.workflow;

import com.example.meetingscheduler.availability.AvailabilityEngine;
import com.example.meetingscheduler.config.SchedulingProperties;
import com.example.meetingscheduler.disambiguation.DisambiguationCoordinator;
import com.example.meetingscheduler.domain.model.ConversationPhase;
import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.model.MeetingStatus;
import com.example.meetingscheduler.domain.payload.AssistantReply;
import com.example.meetingscheduler.domain.payload.ReplyType;
import com.example.meetingscheduler.parser.RequestParser;
import com.example.meetingscheduler.resolver.EntityResolver;
import com.example.meetingscheduler.service.SchedulingContext;
import com.example.meetingscheduler.service.SchedulingOrchestrator;
import com.example.meetingscheduler.workflow.activity.AvailabilityActivity;
import com.example.meetingscheduler.workflow.activity.DirectoryActivity;
import com.example.meetingscheduler.workflow.activity.MeetingStoreActivity;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class MeetingSchedulingWorkflowImpl implements MeetingSchedulingWorkflow {

    private static final Logger logger = Workflow.getLogger(MeetingSchedulingWorkflowImpl.class);

    // Events arrive as signals and are handled one at a time by the main loop
    private final List<UserEvent> pendingEvents = new ArrayList<>();
    private final SchedulingContext context = new SchedulingContext();
    private AssistantReply latestReply;

    // Activities
    private final DirectoryActivity directoryActivity;
    private final AvailabilityActivity availabilityActivity;
    private final MeetingStoreActivity meetingStoreActivity;

    public MeetingSchedulingWorkflowImpl() {
        // Lookups are not retried here; a failure becomes "no data" and the user can try again
        RetryOptions noRetry = RetryOptions.newBuilder()
                .setMaximumAttempts(1)
                .build();

        ActivityOptions lookupOptions = ActivityOptions.newBuilder()
                .setStartToCloseTimeout(Duration.ofSeconds(30))
                .setRetryOptions(noRetry)
                .build();

        ActivityOptions storeOptions = ActivityOptions.newBuilder()
                .setStartToCloseTimeout(Duration.ofMinutes(1))
                .setRetryOptions(noRetry)
                .build();

        this.directoryActivity = Workflow.newActivityStub(DirectoryActivity.class, lookupOptions);
        this.availabilityActivity = Workflow.newActivityStub(AvailabilityActivity.class, lookupOptions);
        this.meetingStoreActivity = Workflow.newActivityStub(MeetingStoreActivity.class, storeOptions);
    }

    @Override
    public MeetingDraft converse(ConversationStart start) {
        SchedulingProperties settings = start.getSettings() != null ? start.getSettings() : new SchedulingProperties();
        SchedulingOrchestrator orchestrator = newOrchestrator(settings);
        Duration idleTimeout = Duration.ofMinutes(start.getIdleTimeoutMinutes() > 0 ? start.getIdleTimeoutMinutes() : 30);
        logger.info("Conversation {} started", Workflow.getInfo().getWorkflowId());

        if (start.getInitialMessage() != null && !start.getInitialMessage().isBlank()) {
            pendingEvents.add(new UserEvent(UserEvent.Type.MESSAGE, start.getInitialMessage(), null, null, 0));
        }

        while (!context.getPhase().isTerminal()) {
            boolean received = Workflow.await(idleTimeout, () -> !pendingEvents.isEmpty());
            if (!received) {
                expire(idleTimeout);
                break;
            }
            UserEvent event = pendingEvents.remove(0);
            latestReply = dispatch(orchestrator, event);
            logger.info("Handled {} -> {} (phase {})", event.getType(), latestReply.getType(), context.getPhase());
        }

        logger.info("Conversation {} finished in phase {}", Workflow.getInfo().getWorkflowId(), context.getPhase());
        return context.getDraft();
    }

    private SchedulingOrchestrator newOrchestrator(SchedulingProperties settings) {
        WorkflowClock clock = new WorkflowClock(settings.zoneId());
        AvailabilityEngine engine = new AvailabilityEngine(
                new ActivityBackedAvailabilityProvider(availabilityActivity), settings, clock);
        return new SchedulingOrchestrator(
                new RequestParser(clock),
                new EntityResolver(),
                new ActivityBackedDirectory(directoryActivity),
                new DisambiguationCoordinator(),
                engine,
                new ActivityBackedMeetingStore(meetingStoreActivity),
                settings,
                clock,
                () -> "MTG_" + Workflow.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT));
    }

    private AssistantReply dispatch(SchedulingOrchestrator orchestrator, UserEvent event) {
        return switch (event.getType()) {
            case MESSAGE -> orchestrator.handleRequest(context, event.getText());
            case CONFIRM_PARTICIPANT -> orchestrator.confirmParticipant(context, event.getQuery(), event.getEmail());
            case ADD_EXTERNAL_PARTICIPANT -> orchestrator.addExternalParticipant(context, event.getQuery(), event.getEmail());
            case SELECT_SLOT -> orchestrator.selectSlot(context, event.getSlotIndex());
            case SCHEDULE -> orchestrator.scheduleDraft(context);
            case CHANGE_TIME -> orchestrator.changeTime(context);
            case CANCEL -> orchestrator.cancel(context);
        };
    }

    private void expire(Duration idleTimeout) {
        logger.info("No activity for {}, cancelling conversation", idleTimeout);
        context.clearPending();
        MeetingDraft draft = context.getDraft();
        if (draft != null && draft.getStatus() == MeetingStatus.DRAFT) {
            draft.setStatus(MeetingStatus.CANCELLED);
        }
        context.setPhase(ConversationPhase.CANCELLED);
        latestReply = AssistantReply.of(ReplyType.CANCELLED,
                "This conversation was closed after " + idleTimeout.toMinutes() + " minutes without activity.");
    }

    @Override
    public void submitMessage(String text) {
        pendingEvents.add(new UserEvent(UserEvent.Type.MESSAGE, text, null, null, 0));
    }

    @Override
    public void confirmParticipant(String query, String email) {
        pendingEvents.add(new UserEvent(UserEvent.Type.CONFIRM_PARTICIPANT, null, query, email, 0));
    }

    @Override
    public void addExternalParticipant(String query, String email) {
        pendingEvents.add(new UserEvent(UserEvent.Type.ADD_EXTERNAL_PARTICIPANT, null, query, email, 0));
    }

    @Override
    public void selectSlot(int index) {
        pendingEvents.add(new UserEvent(UserEvent.Type.SELECT_SLOT, null, null, null, index));
    }

    @Override
    public void scheduleMeeting() {
        pendingEvents.add(UserEvent.of(UserEvent.Type.SCHEDULE));
    }

    @Override
    public void changeTime() {
        pendingEvents.add(UserEvent.of(UserEvent.Type.CHANGE_TIME));
    }

    @Override
    public void cancel() {
        pendingEvents.add(UserEvent.of(UserEvent.Type.CANCEL));
    }

    @Override
    public AssistantReply getLatestReply() {
        return latestReply;
    }

    @Override
    public ConversationPhase getPhase() {
        return context.getPhase();
    }

    @Override
    public MeetingDraft getDraft() {
        return context.getDraft();
    }
}
