package com.example.meetingscheduler.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeSlotCandidate {

    public static final Comparator<TimeSlotCandidate> SOONEST_FIRST =
            Comparator.comparing(TimeSlotCandidate::getDate).thenComparing(TimeSlotCandidate::getStartTime);

    private LocalDate date;
    private LocalTime startTime;
    private LocalTime endTime;
    // emails whose status for this window was confirmed AVAILABLE
    private Set<String> availableParticipants = new LinkedHashSet<>();

    public LocalDateTime startDateTime() {
        return LocalDateTime.of(date, startTime);
    }
}
