package com.example.meetingscheduler.workflow;

import com.example.meetingscheduler.availability.AvailabilityProvider;
import com.example.meetingscheduler.domain.model.AvailabilityStatus;
import com.example.meetingscheduler.workflow.activity.AvailabilityActivity;
import io.temporal.failure.ActivityFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

class ActivityBackedAvailabilityProvider implements AvailabilityProvider {

    private static final Logger logger = Workflow.getLogger(ActivityBackedAvailabilityProvider.class);

    private final AvailabilityActivity activity;

    ActivityBackedAvailabilityProvider(AvailabilityActivity activity) {
        this.activity = activity;
    }

    @Override
    public Map<String, AvailabilityStatus> getAvailability(List<String> emails, LocalDate date,
                                                           LocalTime start, LocalTime end) {
        try {
            return activity.checkAvailability(emails, date, start, end);
        } catch (ActivityFailure e) {
            // an empty map reads as UNKNOWN for everyone
            logger.warn("Availability lookup for {} {} failed: {}", date, start, e.getMessage());
            return Map.of();
        }
    }
}
