package com.example.meetingscheduler.workflow.activity;

import com.example.meetingscheduler.domain.model.AvailabilityStatus;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

@ActivityInterface
public interface AvailabilityActivity {

    @ActivityMethod
    Map<String, AvailabilityStatus> checkAvailability(List<String> emails, LocalDate date, LocalTime start, LocalTime end);
}
