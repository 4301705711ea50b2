package com.example.meetingscheduler.service;

import com.example.meetingscheduler.availability.AvailabilityEngine;
import com.example.meetingscheduler.availability.AvailabilityResult;
import com.example.meetingscheduler.availability.SearchHorizon;
import com.example.meetingscheduler.availability.SlotSearchRequest;
import com.example.meetingscheduler.config.SchedulingProperties;
import com.example.meetingscheduler.disambiguation.ConfirmationOutcome;
import com.example.meetingscheduler.disambiguation.DisambiguationCoordinator;
import com.example.meetingscheduler.disambiguation.DisambiguationState;
import com.example.meetingscheduler.disambiguation.ParticipantPromptPolicy;
import com.example.meetingscheduler.domain.model.ConversationPhase;
import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.model.MeetingStatus;
import com.example.meetingscheduler.domain.model.ParsedRequest;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.domain.model.ParticipantMatch;
import com.example.meetingscheduler.domain.model.TimeSlotCandidate;
import com.example.meetingscheduler.domain.payload.AssistantReply;
import com.example.meetingscheduler.domain.payload.ConfirmationRequestPayload;
import com.example.meetingscheduler.domain.payload.MeetingSummaryPayload;
import com.example.meetingscheduler.domain.payload.ParticipantMatchesPayload;
import com.example.meetingscheduler.domain.payload.ParticipantPrompt;
import com.example.meetingscheduler.domain.payload.ReplyType;
import com.example.meetingscheduler.domain.payload.TimeSlotSuggestionsPayload;
import com.example.meetingscheduler.exception.StoreFailureException;
import com.example.meetingscheduler.exception.ValidationException;
import com.example.meetingscheduler.parser.DurationLabels;
import com.example.meetingscheduler.parser.RequestParser;
import com.example.meetingscheduler.parser.TimeLabels;
import com.example.meetingscheduler.resolver.EntityResolver;
import com.example.meetingscheduler.resolver.ParticipantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Sequences parsing, participant resolution, confirmation, slot search and storage for one
 * conversation.
 *
 * <p>Every operation takes the conversation's {@link SchedulingContext}, moves it to the next
 * {@link ConversationPhase} and answers with an {@link AssistantReply}. Expected outcomes (not
 * understood, ambiguous names, no free time, store failure) are replies, not exceptions.
 */
public class SchedulingOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingOrchestrator.class);

    private static final DateTimeFormatter SLOT_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d 'at' h:mm a", Locale.US);

    private final RequestParser parser;
    private final EntityResolver resolver;
    private final ParticipantDirectory directory;
    private final DisambiguationCoordinator coordinator;
    private final ParticipantPromptPolicy promptPolicy;
    private final AvailabilityEngine availabilityEngine;
    private final MeetingStore meetingStore;
    private final SchedulingProperties properties;
    private final Clock clock;
    private final Supplier<String> draftIdGenerator;

    public SchedulingOrchestrator(RequestParser parser,
                                  EntityResolver resolver,
                                  ParticipantDirectory directory,
                                  DisambiguationCoordinator coordinator,
                                  AvailabilityEngine availabilityEngine,
                                  MeetingStore meetingStore,
                                  SchedulingProperties properties,
                                  Clock clock,
                                  Supplier<String> draftIdGenerator) {
        this.parser = parser;
        this.resolver = resolver;
        this.directory = directory;
        this.coordinator = coordinator;
        this.promptPolicy = new ParticipantPromptPolicy(properties.getMaxParticipantOptions());
        this.availabilityEngine = availabilityEngine;
        this.meetingStore = meetingStore;
        this.properties = properties;
        this.clock = clock;
        this.draftIdGenerator = draftIdGenerator;
    }

    public static Supplier<String> randomDraftIds() {
        return () -> "MTG_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------------------------------------
    // New request
    // ---------------------------------------------------------------------------------------------

    public AssistantReply handleRequest(SchedulingContext ctx, String text) {
        if (isAwaitingUser(ctx.getPhase())) {
            return AssistantReply.of(ReplyType.VALIDATION_ERROR,
                    "Please finish or cancel the meeting you are setting up before starting a new one.");
        }
        ctx.reset();

        ParsedRequest parsed = parser.parse(text);
        logger.debug("Parsed request with confidence {}: names={}, emails={}",
                parsed.getConfidence(), parsed.getParticipantNames(), parsed.getParticipantEmails());
        if (!parsed.isUnderstood(properties.getMinimumConfidence())) {
            return AssistantReply.of(ReplyType.NOT_UNDERSTOOD,
                    "I couldn't understand that as a meeting request. Try something like "
                            + "\"Schedule a meeting with Sarah tomorrow at 2pm for 1 hour\".");
        }
        if (!parsed.hasParticipantQueries()) {
            return AssistantReply.of(ReplyType.NEEDS_PARTICIPANTS,
                    "Who should attend? Mention people by name or email address.");
        }

        List<ParticipantMatch> matches =
                resolver.resolve(parsed.getParticipantNames(), parsed.getParticipantEmails(), directory);
        ConfirmationOutcome outcome = coordinator.begin(ctx.getDisambiguation(), parsed, matches);
        if (outcome.isFinalized()) {
            return searchAvailability(ctx, outcome.getParticipants(), outcome.getRequest());
        }

        ctx.setPhase(ConversationPhase.AWAITING_PARTICIPANTS);
        return AssistantReply.of(ReplyType.PARTICIPANTS_NEED_CONFIRMATION,
                "I need you to confirm a few participants: " + String.join(", ", outcome.getRemainingQueries()),
                new ParticipantMatchesPayload(pendingPrompts(ctx.getDisambiguation())));
    }

    // ---------------------------------------------------------------------------------------------
    // Participant confirmation
    // ---------------------------------------------------------------------------------------------

    public AssistantReply confirmParticipant(SchedulingContext ctx, String query, String email) {
        if (ctx.getPhase() != ConversationPhase.AWAITING_PARTICIPANTS) {
            return nothingPending();
        }
        Optional<ParticipantIdentity> chosen = ctx.getDisambiguation().getMatches().stream()
                .filter(match -> match.getQuery().equals(query))
                .flatMap(match -> match.getCandidates().stream())
                .filter(candidate -> candidate.getEmail().equalsIgnoreCase(email))
                .findFirst();
        if (chosen.isEmpty()) {
            return AssistantReply.of(ReplyType.VALIDATION_ERROR,
                    "'" + email + "' is not one of the options for '" + query + "'.");
        }
        try {
            return afterConfirmation(ctx, coordinator.confirm(ctx.getDisambiguation(), query, chosen.get()));
        } catch (ValidationException e) {
            return AssistantReply.of(ReplyType.VALIDATION_ERROR, e.getMessage());
        }
    }

    public AssistantReply addExternalParticipant(SchedulingContext ctx, String query, String email) {
        if (ctx.getPhase() != ConversationPhase.AWAITING_PARTICIPANTS) {
            return nothingPending();
        }
        try {
            String address = email == null || email.isBlank() ? query : email;
            return afterConfirmation(ctx, coordinator.addExternal(ctx.getDisambiguation(), query, address));
        } catch (ValidationException e) {
            logger.debug("Rejected external participant for '{}': {}", query, e.getMessage());
            return AssistantReply.of(ReplyType.VALIDATION_ERROR, e.getMessage());
        }
    }

    private AssistantReply afterConfirmation(SchedulingContext ctx, ConfirmationOutcome outcome) {
        if (outcome.isFinalized()) {
            return searchAvailability(ctx, outcome.getParticipants(), outcome.getRequest());
        }
        return AssistantReply.of(ReplyType.PARTICIPANT_CONFIRMED,
                "Got it. Still to confirm: " + String.join(", ", outcome.getRemainingQueries()),
                new ParticipantMatchesPayload(pendingPrompts(ctx.getDisambiguation())));
    }

    private List<ParticipantPrompt> pendingPrompts(DisambiguationState state) {
        List<String> unresolved = state.unresolvedQueries();
        List<ParticipantPrompt> prompts = new ArrayList<>();
        for (String query : unresolved) {
            Optional<ParticipantMatch> match = state.getMatches().stream()
                    .filter(m -> m.getQuery().equals(query))
                    .findFirst();
            // a query the resolver dropped (malformed email) can still be added as external
            prompts.add(match.map(promptPolicy::prompt)
                    .orElseGet(() -> new ParticipantPrompt(query, 0.0, false, new ArrayList<>(), 0, true)));
        }
        return prompts;
    }

    // ---------------------------------------------------------------------------------------------
    // Slot search and selection
    // ---------------------------------------------------------------------------------------------

    private AssistantReply searchAvailability(SchedulingContext ctx, List<ParticipantIdentity> participants,
                                              ParsedRequest request) {
        ctx.setRequest(request);
        ctx.setParticipants(new ArrayList<>(participants));

        LocalDate targetDate = request.getDateMentioned() != null
                ? request.getDateMentioned()
                : LocalDate.now(clock).plusDays(1);
        int duration = DurationLabels.toMinutes(request.getDurationMentioned())
                .orElse(properties.getDefaultDurationMinutes());
        ctx.setDurationMinutes(duration);
        LocalTime requestedStart = TimeLabels.toLocalTime(request.getTimeMentioned());
        SearchHorizon horizon = requestedStart == null
                ? SearchHorizon.singleDay()
                : SearchHorizon.conflictRecovery(properties.getConflictHorizonDays());

        List<String> emails = participants.stream().map(ParticipantIdentity::getEmail).toList();
        AvailabilityResult result = availabilityEngine.check(
                new SlotSearchRequest(emails, targetDate, requestedStart, duration, horizon));

        if (result.getOutcome() == AvailabilityResult.Outcome.ACCEPTED) {
            ctx.setDraft(MeetingDraftFactory.create(request, participants, result.getAcceptedSlot(), duration));
            return draftReady(ctx, "Everyone is free then. Here is your meeting:");
        }
        if (!result.hasAlternatives()) {
            ctx.clearPending();
            ctx.setPhase(ConversationPhase.IDLE);
            return AssistantReply.of(ReplyType.NO_AVAILABILITY,
                    "I couldn't find a time when everyone is free around " + targetDate
                            + ". Please try a different date.");
        }

        String conflictMessage = null;
        if (result.getOutcome() == AvailabilityResult.Outcome.CONFLICT) {
            conflictMessage = result.getConflictingParticipants().isEmpty()
                    ? "The requested time is no longer available."
                    : "Not everyone is free then: " + String.join(", ", result.getConflictingParticipants()) + ".";
        }
        return offerSlots(ctx, result.getAlternatives(), result.getConflictingParticipants(), conflictMessage);
    }

    public AssistantReply selectSlot(SchedulingContext ctx, int index) {
        if (ctx.getPhase() != ConversationPhase.AWAITING_SLOT_SELECTION) {
            return nothingPending();
        }
        List<TimeSlotCandidate> slots = ctx.getSuggestedSlots();
        if (index < 0 || index >= slots.size()) {
            return AssistantReply.of(ReplyType.VALIDATION_ERROR,
                    "Please pick a slot between 1 and " + slots.size() + ".");
        }
        TimeSlotCandidate slot = slots.get(index);
        MeetingDraft existing = ctx.getDraft();
        if (existing != null && existing.getStatus() == MeetingStatus.DRAFT) {
            // moving an existing draft keeps its title, id and participants
            existing.setStartTime(slot.startDateTime());
        } else {
            ctx.setDraft(MeetingDraftFactory.create(ctx.getRequest(), ctx.getParticipants(), slot, ctx.getDurationMinutes()));
        }
        ctx.setSuggestedSlots(new ArrayList<>());
        return draftReady(ctx, "Here is your meeting:");
    }

    public AssistantReply changeTime(SchedulingContext ctx) {
        MeetingDraft draft = ctx.getDraft();
        if (ctx.getPhase() != ConversationPhase.AWAITING_CONFIRMATION || draft == null) {
            return nothingPending();
        }
        LocalDate from = draft.getStartTime() != null
                ? draft.getStartTime().toLocalDate()
                : LocalDate.now(clock);
        List<TimeSlotCandidate> slots = availabilityEngine.findSlots(draft.participantEmails(), from,
                draft.getDurationMinutes(), SearchHorizon.changeTime(properties.getChangeTimeHorizonDays()));
        if (slots.isEmpty()) {
            return AssistantReply.of(ReplyType.NO_AVAILABILITY,
                    "I couldn't find another time when everyone is free. The current time is kept.",
                    new MeetingSummaryPayload(draft), ConfirmationRequestPayload.forDraft(draft.getTitle()));
        }
        return offerSlots(ctx, slots, List.of(), null);
    }

    private AssistantReply offerSlots(SchedulingContext ctx, List<TimeSlotCandidate> slots,
                                      List<String> conflicting, String conflictMessage) {
        ctx.setSuggestedSlots(new ArrayList<>(slots));
        ctx.setPhase(ConversationPhase.AWAITING_SLOT_SELECTION);
        List<TimeSlotCandidate> preview = new ArrayList<>(slots.subList(0, Math.min(slots.size(), properties.getMaxPreviewSlots())));
        StringBuilder message = new StringBuilder();
        if (conflictMessage != null) {
            message.append(conflictMessage).append(' ');
        }
        message.append("Here are the times when everyone is free:");
        for (int i = 0; i < preview.size(); i++) {
            message.append("\n").append(i + 1).append(". ").append(preview.get(i).startDateTime().format(SLOT_FORMAT));
        }
        return AssistantReply.of(ReplyType.SLOT_SUGGESTIONS, message.toString(),
                new TimeSlotSuggestionsPayload(preview, slots.size(), new ArrayList<>(conflicting), conflictMessage));
    }

    private AssistantReply draftReady(SchedulingContext ctx, String lead) {
        MeetingDraft draft = ctx.getDraft();
        ctx.setPhase(ConversationPhase.AWAITING_CONFIRMATION);
        String message = lead + " \"" + draft.getTitle() + "\" on " + draft.getStartTime().format(SLOT_FORMAT)
                + " for " + DurationLabels.label(draft.getDurationMinutes()) + ".";
        return AssistantReply.of(ReplyType.DRAFT_READY, message,
                new MeetingSummaryPayload(draft), ConfirmationRequestPayload.forDraft(draft.getTitle()));
    }

    // ---------------------------------------------------------------------------------------------
    // Scheduling and cancellation
    // ---------------------------------------------------------------------------------------------

    public AssistantReply scheduleDraft(SchedulingContext ctx) {
        MeetingDraft draft = ctx.getDraft();
        if (ctx.getPhase() != ConversationPhase.AWAITING_CONFIRMATION || draft == null) {
            return nothingPending();
        }
        if (draft.getId() == null) {
            draft.setId(draftIdGenerator.get());
        }
        draft.setStatus(MeetingStatus.SCHEDULED);
        try {
            meetingStore.save(draft);
        } catch (StoreFailureException e) {
            logger.debug("Saving meeting {} failed: {}", draft.getId(), e.getMessage());
            draft.setStatus(MeetingStatus.DRAFT);
            return AssistantReply.of(ReplyType.STORE_FAILURE,
                    "I couldn't save the meeting just now. Your draft is kept, please try scheduling again.",
                    new MeetingSummaryPayload(draft), ConfirmationRequestPayload.forDraft(draft.getTitle()));
        }
        ctx.clearPending();
        ctx.setPhase(ConversationPhase.SCHEDULED);
        logger.debug("Meeting {} scheduled for {}", draft.getId(), draft.getStartTime());
        return AssistantReply.of(ReplyType.SCHEDULED,
                "\"" + draft.getTitle() + "\" is scheduled for " + draft.getStartTime().format(SLOT_FORMAT) + ".",
                new MeetingSummaryPayload(draft));
    }

    public AssistantReply cancel(SchedulingContext ctx) {
        if (ctx.getPhase() == ConversationPhase.SCHEDULED) {
            return AssistantReply.of(ReplyType.NOTHING_PENDING,
                    "This meeting is already scheduled and was left unchanged.");
        }
        if (ctx.getPhase() == ConversationPhase.IDLE || ctx.getPhase() == ConversationPhase.CANCELLED) {
            return nothingPending();
        }
        ctx.clearPending();
        MeetingDraft draft = ctx.getDraft();
        if (draft != null && draft.getStatus() == MeetingStatus.DRAFT) {
            draft.setStatus(MeetingStatus.CANCELLED);
        }
        ctx.setPhase(ConversationPhase.CANCELLED);
        logger.debug("Meeting request cancelled");
        return AssistantReply.of(ReplyType.CANCELLED, "Okay, I've cancelled this meeting request.");
    }

    private static boolean isAwaitingUser(ConversationPhase phase) {
        return phase == ConversationPhase.AWAITING_PARTICIPANTS
                || phase == ConversationPhase.AWAITING_SLOT_SELECTION
                || phase == ConversationPhase.AWAITING_CONFIRMATION;
    }

    private static AssistantReply nothingPending() {
        return AssistantReply.of(ReplyType.NOTHING_PENDING, "There is nothing waiting for that action right now.");
    }
}
