package com.example.meetingscheduler.disambiguation;

import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.domain.model.ParticipantMatch;
import com.example.meetingscheduler.domain.payload.ParticipantPrompt;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides what the user is shown for each query that still needs a decision.
 */
public class ParticipantPromptPolicy {

    public static final int DEFAULT_MAX_OPTIONS = 5;

    private final int maxOptions;

    public ParticipantPromptPolicy() {
        this(DEFAULT_MAX_OPTIONS);
    }

    public ParticipantPromptPolicy(int maxOptions) {
        this.maxOptions = maxOptions;
    }

    public List<ParticipantPrompt> prompts(List<ParticipantMatch> matches) {
        List<ParticipantPrompt> prompts = new ArrayList<>();
        for (ParticipantMatch match : matches) {
            if (match.needsConfirmation()) {
                prompts.add(prompt(match));
            }
        }
        return prompts;
    }

    public ParticipantPrompt prompt(ParticipantMatch match) {
        int total = match.hasCandidates() ? match.getCandidates().size() : 0;
        List<ParticipantIdentity> options = total == 0
                ? new ArrayList<>()
                : new ArrayList<>(match.getCandidates().subList(0, Math.min(total, maxOptions)));
        return new ParticipantPrompt(match.getQuery(), match.getConfidence(), match.isExact(),
                options, total, total == 0);
    }
}
