package com.example.meetingscheduler.workflow.activity;

import com.example.meetingscheduler.domain.model.MeetingDraft;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

@ActivityInterface
public interface MeetingStoreActivity {

    @ActivityMethod
    void saveMeeting(MeetingDraft draft);
}
