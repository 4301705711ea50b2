package com.example.meetingscheduler.disambiguation;

import com.example.meetingscheduler.domain.model.ParsedRequest;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.domain.model.ParticipantMatch;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Confirmations collected for one in-flight request. Owned by the conversation, never shared.
 */
@Data
@NoArgsConstructor
public class DisambiguationState {

    private ParsedRequest pendingRequest;
    private List<ParticipantMatch> matches = new ArrayList<>();
    // query -> chosen identity, in the order the user confirmed them
    private Map<String, ParticipantIdentity> confirmations = new LinkedHashMap<>();

    public boolean isActive() {
        return pendingRequest != null;
    }

    /**
     * Every name and email query of the pending request.
     */
    public Set<String> requiredQueries() {
        Set<String> required = new LinkedHashSet<>();
        if (pendingRequest != null) {
            required.addAll(pendingRequest.getParticipantNames());
            required.addAll(pendingRequest.getParticipantEmails());
        }
        return required;
    }

    public List<String> unresolvedQueries() {
        List<String> unresolved = new ArrayList<>(requiredQueries());
        unresolved.removeAll(confirmations.keySet());
        return unresolved;
    }

    public void reset() {
        pendingRequest = null;
        matches = new ArrayList<>();
        confirmations = new LinkedHashMap<>();
    }
}
