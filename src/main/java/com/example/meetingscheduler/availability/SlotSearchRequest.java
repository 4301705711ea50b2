package com.example.meetingscheduler.availability;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Value
public class SlotSearchRequest {

    List<String> participantEmails;
    LocalDate targetDate;
    // null when the user did not ask for a specific time
    LocalTime requestedStart;
    int durationMinutes;
    SearchHorizon horizon;

    public boolean hasRequestedStart() {
        return requestedStart != null;
    }
}
