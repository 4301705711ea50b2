package com.example.meetingscheduler.domain.payload;

import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the user is shown for one unresolved query.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantPrompt {
    private String query;
    private double confidence;
    private boolean exact;
    private List<ParticipantIdentity> options = new ArrayList<>();
    private int totalCandidates;
    private boolean offerExternal;
}
