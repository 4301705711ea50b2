package com.example.meetingscheduler.workflow.activity;

import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

import java.util.List;

@ActivityInterface
public interface DirectoryActivity {

    @ActivityMethod
    List<ParticipantIdentity> listParticipants();

    /**
     * @return the entry, or null when the email is not in the directory
     */
    @ActivityMethod
    ParticipantIdentity findByEmail(String email);

    @ActivityMethod
    List<ParticipantIdentity> searchParticipants(String query, int limit);
}
