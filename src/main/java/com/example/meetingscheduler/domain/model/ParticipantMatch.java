package com.example.meetingscheduler.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Directory candidates for one name or email token, best first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantMatch {

    private String query;
    private List<ParticipantIdentity> candidates = new ArrayList<>();
    private double confidence;
    private boolean exact;
    private boolean emailQuery;

    public boolean needsConfirmation() {
        return !exact || candidates.size() > 1;
    }

    public boolean hasCandidates() {
        return candidates != null && !candidates.isEmpty();
    }
}
