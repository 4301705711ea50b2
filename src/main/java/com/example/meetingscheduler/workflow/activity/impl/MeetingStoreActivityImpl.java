package com.example.meetingscheduler.workflow.activity.impl;

import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.service.MeetingStore;
import com.example.meetingscheduler.workflow.activity.MeetingStoreActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MeetingStoreActivityImpl implements MeetingStoreActivity {

    private static final Logger logger = LoggerFactory.getLogger(MeetingStoreActivityImpl.class);

    private final MeetingStore meetingStore;

    public MeetingStoreActivityImpl(MeetingStore meetingStore) {
        this.meetingStore = meetingStore;
    }

    @Override
    public void saveMeeting(MeetingDraft draft) {
        logger.info("Saving meeting {} ('{}')", draft.getId(), draft.getTitle());
        // a StoreFailureException surfaces in the workflow as an ActivityFailure
        meetingStore.save(draft);
    }
}
