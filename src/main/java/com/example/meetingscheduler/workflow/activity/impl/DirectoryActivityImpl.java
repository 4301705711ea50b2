package com.example.meetingscheduler.workflow.activity.impl;

import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.resolver.ParticipantDirectory;
import com.example.meetingscheduler.workflow.activity.DirectoryActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DirectoryActivityImpl implements DirectoryActivity {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryActivityImpl.class);

    private final ParticipantDirectory directory;

    public DirectoryActivityImpl(ParticipantDirectory directory) {
        this.directory = directory;
    }

    @Override
    public List<ParticipantIdentity> listParticipants() {
        List<ParticipantIdentity> participants = directory.listParticipants();
        logger.debug("Directory listing returned {} entries", participants.size());
        return participants;
    }

    @Override
    public ParticipantIdentity findByEmail(String email) {
        return directory.getByEmail(email).orElse(null);
    }

    @Override
    public List<ParticipantIdentity> searchParticipants(String query, int limit) {
        return directory.search(query, limit);
    }
}
