package com.example.meetingscheduler.disambiguation;

import com.example.meetingscheduler.domain.model.ParsedRequest;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.domain.model.ParticipantMatch;
import com.example.meetingscheduler.exception.ValidationException;
import com.example.meetingscheduler.util.EmailAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collects the user's choices for ambiguous participant queries.
 *
 * <p>The coordinator holds no state of its own; everything lives in the {@link DisambiguationState}
 * passed to each call. Participants are released only once every original query has a confirmed
 * identity, after which the state is cleared.
 */
public class DisambiguationCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(DisambiguationCoordinator.class);

    public boolean requiresDisambiguation(List<ParticipantMatch> matches) {
        return matches.stream().anyMatch(ParticipantMatch::needsConfirmation);
    }

    /**
     * Starts collecting confirmations for a request. Unambiguous matches are confirmed straight away.
     */
    public ConfirmationOutcome begin(DisambiguationState state, ParsedRequest request, List<ParticipantMatch> matches) {
        state.reset();
        state.setPendingRequest(request);
        state.setMatches(new ArrayList<>(matches));
        for (ParticipantMatch match : matches) {
            if (!match.needsConfirmation()) {
                state.getConfirmations().put(match.getQuery(), match.getCandidates().get(0));
            }
        }
        return evaluate(state);
    }

    public ConfirmationOutcome confirm(DisambiguationState state, String query, ParticipantIdentity identity) {
        if (!state.isActive()) {
            throw new ValidationException("There is no participant selection in progress");
        }
        if (!state.requiredQueries().contains(query)) {
            throw new ValidationException("'" + query + "' is not one of the participants in this request");
        }
        state.getConfirmations().put(query, identity);
        logger.debug("Confirmed '{}' as {}", query, identity.getEmail());
        return evaluate(state);
    }

    public ConfirmationOutcome addExternal(DisambiguationState state, String query) {
        return addExternal(state, query, query);
    }

    /**
     * Confirms {@code query} as an outside participant reachable at {@code email}.
     *
     * @throws ValidationException if the email is missing an '@' or is otherwise malformed
     */
    public ConfirmationOutcome addExternal(DisambiguationState state, String query, String email) {
        if (email == null || !email.contains("@")) {
            throw new ValidationException("An external participant needs an email address, got '" + email + "'");
        }
        if (!EmailAddresses.isValid(email)) {
            throw new ValidationException("'" + email + "' is not a valid email address");
        }
        String address = email.trim();
        return confirm(state, query, ParticipantIdentity.external(address, EmailAddresses.displayNameFromEmail(address)));
    }

    private ConfirmationOutcome evaluate(DisambiguationState state) {
        List<String> unresolved = state.unresolvedQueries();
        if (!unresolved.isEmpty()) {
            return ConfirmationOutcome.pending(unresolved);
        }
        Map<String, ParticipantIdentity> byEmail = new LinkedHashMap<>();
        for (ParticipantIdentity identity : state.getConfirmations().values()) {
            byEmail.putIfAbsent(identity.getEmail().toLowerCase(Locale.ROOT), identity);
        }
        ParsedRequest request = state.getPendingRequest();
        state.reset();
        logger.debug("All participants confirmed: {}", byEmail.keySet());
        return ConfirmationOutcome.finalized(new ArrayList<>(byEmail.values()), request);
    }
}
