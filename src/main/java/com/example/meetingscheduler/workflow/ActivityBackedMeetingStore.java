package com.example.meetingscheduler.workflow;

import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.exception.StoreFailureException;
import com.example.meetingscheduler.service.MeetingStore;
import com.example.meetingscheduler.workflow.activity.MeetingStoreActivity;
import io.temporal.failure.ActivityFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

class ActivityBackedMeetingStore implements MeetingStore {

    private static final Logger logger = Workflow.getLogger(ActivityBackedMeetingStore.class);

    private final MeetingStoreActivity activity;

    ActivityBackedMeetingStore(MeetingStoreActivity activity) {
        this.activity = activity;
    }

    @Override
    public void save(MeetingDraft draft) {
        try {
            activity.saveMeeting(draft);
        } catch (ActivityFailure e) {
            String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            logger.warn("Saving meeting {} failed: {}", draft.getId(), reason);
            throw new StoreFailureException(draft.getId(), reason, e);
        }
    }
}
