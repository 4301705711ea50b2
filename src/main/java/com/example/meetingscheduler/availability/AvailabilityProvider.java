package com.example.meetingscheduler.availability;

import com.example.meetingscheduler.domain.model.AvailabilityStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

public interface AvailabilityProvider {

    /**
     * Status of each participant for the window [start, end) on {@code date}. Emails missing from
     * the result are treated as {@link AvailabilityStatus#UNKNOWN}.
     */
    Map<String, AvailabilityStatus> getAvailability(List<String> emails, LocalDate date, LocalTime start, LocalTime end);
}
