package com.example.meetingscheduler.service;

import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.exception.StoreFailureException;

/**
 * Where scheduled meetings end up. Saving is idempotent on {@link MeetingDraft#getId()}.
 */
public interface MeetingStore {

    void save(MeetingDraft draft) throws StoreFailureException;
}
