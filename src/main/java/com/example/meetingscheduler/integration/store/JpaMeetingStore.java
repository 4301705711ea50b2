package com.example.meetingscheduler.integration.store;

import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.model.MeetingRecord;
import com.example.meetingscheduler.domain.repository.MeetingRecordRepository;
import com.example.meetingscheduler.exception.StoreFailureException;
import com.example.meetingscheduler.service.MeetingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;

/**
 * Stores meetings in the relational database, one row per draft id.
 */
@Service
public class JpaMeetingStore implements MeetingStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaMeetingStore.class);

    private final MeetingRecordRepository repository;

    public JpaMeetingStore(MeetingRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void save(MeetingDraft draft) {
        if (draft.getId() == null || draft.getId().isBlank()) {
            throw new StoreFailureException(null, "Cannot store a meeting without a draft id");
        }
        if (draft.getStartTime() == null) {
            throw new StoreFailureException(draft.getId(), "Cannot store a meeting without a start time");
        }
        try {
            // upsert: a retry of the same draft overwrites the earlier attempt
            MeetingRecord record = repository.findById(draft.getId()).orElseGet(MeetingRecord::new);
            boolean existed = record.getId() != null;
            record.setId(draft.getId());
            record.setTitle(draft.getTitle());
            record.setDescription(draft.getDescription());
            record.setParticipantEmails(new ArrayList<>(draft.participantEmails()));
            record.setStartTime(draft.getStartTime());
            record.setDurationMinutes(draft.getDurationMinutes());
            record.setPriority(draft.getPriority());
            record.setStatus(draft.getStatus());
            repository.saveAndFlush(record);
            logger.info("{} meeting {} ('{}') at {}", existed ? "Updated" : "Stored",
                    draft.getId(), draft.getTitle(), draft.getStartTime());
        } catch (DataAccessException e) {
            logger.error("Failed to store meeting {}", draft.getId(), e);
            throw new StoreFailureException(draft.getId(), "Failed to store meeting: " + e.getMessage(), e);
        }
    }
}
