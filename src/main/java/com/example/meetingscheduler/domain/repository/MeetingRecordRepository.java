package com.example.meetingscheduler.domain.repository;

import com.example.meetingscheduler.domain.model.MeetingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MeetingRecordRepository extends JpaRepository<MeetingRecord, String> {
}
