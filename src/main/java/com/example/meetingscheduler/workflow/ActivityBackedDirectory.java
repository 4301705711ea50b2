package com.example.meetingscheduler.workflow;

import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.resolver.ParticipantDirectory;
import com.example.meetingscheduler.workflow.activity.DirectoryActivity;
import io.temporal.failure.ActivityFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Directory lookups from workflow code. A failed lookup is reported as "no data", not retried.
 */
class ActivityBackedDirectory implements ParticipantDirectory {

    private static final Logger logger = Workflow.getLogger(ActivityBackedDirectory.class);

    private final DirectoryActivity activity;

    ActivityBackedDirectory(DirectoryActivity activity) {
        this.activity = activity;
    }

    @Override
    public List<ParticipantIdentity> listParticipants() {
        try {
            return activity.listParticipants();
        } catch (ActivityFailure e) {
            logger.warn("Directory listing failed, continuing without directory data: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<ParticipantIdentity> getByEmail(String email) {
        try {
            return Optional.ofNullable(activity.findByEmail(email));
        } catch (ActivityFailure e) {
            logger.warn("Directory lookup for {} failed: {}", email, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<ParticipantIdentity> search(String query, int limit) {
        try {
            return activity.searchParticipants(query, limit);
        } catch (ActivityFailure e) {
            logger.warn("Directory search for '{}' failed: {}", query, e.getMessage());
            return List.of();
        }
    }
}
