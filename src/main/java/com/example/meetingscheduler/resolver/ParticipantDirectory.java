package com.example.meetingscheduler.resolver;

import com.example.meetingscheduler.domain.model.ParticipantIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the people that can be invited.
 */
public interface ParticipantDirectory {

    List<ParticipantIdentity> listParticipants();

    Optional<ParticipantIdentity> getByEmail(String email);

    /**
     * Entries whose name or email contains the query, at most {@code limit} of them.
     */
    List<ParticipantIdentity> search(String query, int limit);
}
