package com.example.meetingscheduler.workflow.activity.impl;

import com.example.meetingscheduler.availability.AvailabilityProvider;
import com.example.meetingscheduler.domain.model.AvailabilityStatus;
import com.example.meetingscheduler.workflow.activity.AvailabilityActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

@Component
public class AvailabilityActivityImpl implements AvailabilityActivity {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityActivityImpl.class);

    private final AvailabilityProvider availabilityProvider;

    public AvailabilityActivityImpl(AvailabilityProvider availabilityProvider) {
        this.availabilityProvider = availabilityProvider;
    }

    @Override
    public Map<String, AvailabilityStatus> checkAvailability(List<String> emails, LocalDate date,
                                                             LocalTime start, LocalTime end) {
        Map<String, AvailabilityStatus> statuses = availabilityProvider.getAvailability(emails, date, start, end);
        logger.debug("Availability on {} {}-{}: {}", date, start, end, statuses);
        return statuses;
    }
}
