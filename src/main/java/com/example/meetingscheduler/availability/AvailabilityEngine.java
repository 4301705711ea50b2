package com.example.meetingscheduler.availability;

import com.example.meetingscheduler.config.SchedulingProperties;
import com.example.meetingscheduler.domain.model.AvailabilityStatus;
import com.example.meetingscheduler.domain.model.TimeSlotCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a requested window against every participant's calendar and searches for windows where
 * all of them are free.
 *
 * <p>Candidate windows are fixed-size buckets inside the working day, stepping by the configured
 * slot length. A window never crosses the end of the working day and never starts before "now"
 * as seen by the injected clock.
 */
public class AvailabilityEngine {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityEngine.class);

    private final AvailabilityProvider provider;
    private final LocalTime workdayStart;
    private final LocalTime workdayEnd;
    private final int slotMinutes;
    private final UnknownStatusPolicy unknownStatusPolicy;
    private final Clock clock;

    public AvailabilityEngine(AvailabilityProvider provider, LocalTime workdayStart, LocalTime workdayEnd,
                              int slotMinutes, UnknownStatusPolicy unknownStatusPolicy, Clock clock) {
        if (slotMinutes <= 0) {
            throw new IllegalArgumentException("slotMinutes must be positive: " + slotMinutes);
        }
        if (!workdayStart.isBefore(workdayEnd)) {
            throw new IllegalArgumentException("Working day must start before it ends: " + workdayStart + "-" + workdayEnd);
        }
        this.provider = provider;
        this.workdayStart = workdayStart;
        this.workdayEnd = workdayEnd;
        this.slotMinutes = slotMinutes;
        this.unknownStatusPolicy = unknownStatusPolicy;
        this.clock = clock;
    }

    public AvailabilityEngine(AvailabilityProvider provider, SchedulingProperties properties, Clock clock) {
        this(provider, properties.workdayStartTime(), properties.workdayEndTime(),
                properties.getSlotMinutes(), properties.getUnknownStatusPolicy(), clock);
    }

    public AvailabilityResult check(SlotSearchRequest request) {
        if (!request.hasRequestedStart()) {
            List<TimeSlotCandidate> slots = findSlots(request.getParticipantEmails(), request.getTargetDate(),
                    request.getDurationMinutes(), request.getHorizon());
            return AvailabilityResult.suggestions(slots);
        }

        LocalDate date = request.getTargetDate();
        LocalTime start = request.getRequestedStart();
        LocalTime end = start.plusMinutes(request.getDurationMinutes());
        List<String> conflicting = new ArrayList<>();
        if (LocalDateTime.of(date, start).isBefore(LocalDateTime.now(clock))) {
            logger.debug("Requested window {} {} is already in the past", date, start);
        } else if (!fitsInWorkday(start, request.getDurationMinutes())) {
            logger.debug("Requested window {} {} for {} min falls outside {}-{}", date, start,
                    request.getDurationMinutes(), workdayStart, workdayEnd);
        } else {
            Map<String, AvailabilityStatus> statuses =
                    provider.getAvailability(request.getParticipantEmails(), date, start, end);
            for (String email : request.getParticipantEmails()) {
                if (blocks(statusOf(statuses, email))) {
                    conflicting.add(email);
                }
            }
            if (conflicting.isEmpty()) {
                return AvailabilityResult.accepted(candidate(date, start, end, request.getParticipantEmails(), statuses));
            }
        }

        logger.debug("Conflict for {} {}-{}: {}", date, start, end, conflicting);
        List<TimeSlotCandidate> alternatives = findSlots(request.getParticipantEmails(), date,
                request.getDurationMinutes(), request.getHorizon());
        return AvailabilityResult.conflict(conflicting, alternatives);
    }

    /**
     * Every window in the horizon where all participants are free, soonest first.
     */
    public List<TimeSlotCandidate> findSlots(List<String> emails, LocalDate targetDate, int durationMinutes,
                                             SearchHorizon horizon) {
        List<TimeSlotCandidate> slots = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate first = targetDate.plusDays(horizon.getFirstDayOffset());

        for (int day = 0; day < horizon.getDays(); day++) {
            LocalDate date = first.plusDays(day);
            LocalTime start = workdayStart;
            while (fitsInWorkday(start, durationMinutes)) {
                LocalTime end = start.plusMinutes(durationMinutes);
                if (!LocalDateTime.of(date, start).isBefore(now)) {
                    Map<String, AvailabilityStatus> statuses = provider.getAvailability(emails, date, start, end);
                    boolean everyoneFree = emails.stream().noneMatch(email -> blocks(statusOf(statuses, email)));
                    if (everyoneFree) {
                        slots.add(candidate(date, start, end, emails, statuses));
                    }
                }
                LocalTime next = start.plusMinutes(slotMinutes);
                if (!next.isAfter(start)) {
                    break; // wrapped past midnight
                }
                start = next;
            }
        }
        slots.sort(TimeSlotCandidate.SOONEST_FIRST);
        logger.debug("Found {} free slot(s) from {} over {} day(s)", slots.size(), first, horizon.getDays());
        return slots;
    }

    private boolean fitsInWorkday(LocalTime start, int durationMinutes) {
        long minutesLeft = Duration.between(start, workdayEnd).toMinutes();
        return minutesLeft >= durationMinutes && !start.isBefore(workdayStart);
    }

    private boolean blocks(AvailabilityStatus status) {
        return switch (status) {
            case AVAILABLE -> false;
            case BUSY -> true;
            case UNKNOWN -> switch (unknownStatusPolicy) {
                case AS_AVAILABLE -> false;
                case AS_CONFLICT -> true;
            };
        };
    }

    private static AvailabilityStatus statusOf(Map<String, AvailabilityStatus> statuses, String email) {
        if (statuses == null) {
            return AvailabilityStatus.UNKNOWN;
        }
        AvailabilityStatus status = statuses.get(email);
        return status == null ? AvailabilityStatus.UNKNOWN : status;
    }

    private static TimeSlotCandidate candidate(LocalDate date, LocalTime start, LocalTime end, List<String> emails,
                                               Map<String, AvailabilityStatus> statuses) {
        Set<String> confirmed = new LinkedHashSet<>();
        for (String email : emails) {
            if (statusOf(statuses, email) == AvailabilityStatus.AVAILABLE) {
                confirmed.add(email);
            }
        }
        return new TimeSlotCandidate(date, start, end, confirmed);
    }
}
