package com.example.meetingscheduler.availability;

import com.example.meetingscheduler.domain.model.AvailabilityStatus;
import com.example.meetingscheduler.domain.model.TimeSlotCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AvailabilityEngineTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 11);
    private static final LocalDate TARGET = TODAY.plusDays(1);
    private static final String ANN = "ann@company.com";
    private static final String BOB = "bob@company.com";
    private static final String GUEST = "guest@partner.io";

    private FakeCalendar calendar;
    private Clock clock;

    @BeforeEach
    public void setUp() {
        calendar = new FakeCalendar(Set.of(ANN, BOB));
        clock = Clock.fixed(TODAY.atTime(10, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    private AvailabilityEngine engine(UnknownStatusPolicy policy) {
        return new AvailabilityEngine(calendar, LocalTime.of(9, 0), LocalTime.of(17, 0), 30, policy, clock);
    }

    @Test
    public void testFreeRequestedSlotIsAccepted() {
        AvailabilityResult result = engine(UnknownStatusPolicy.AS_AVAILABLE).check(
                new SlotSearchRequest(List.of(ANN, BOB), TARGET, LocalTime.of(14, 0), 60, SearchHorizon.conflictRecovery(2)));

        assertEquals(AvailabilityResult.Outcome.ACCEPTED, result.getOutcome());
        TimeSlotCandidate slot = result.getAcceptedSlot();
        assertEquals(LocalTime.of(15, 0), slot.getEndTime());
        assertEquals(Set.of(ANN, BOB), slot.getAvailableParticipants());
    }

    @Test
    public void testConflictReturnsOrderedAlternativesWithinHorizon() {
        calendar.busy(BOB, TARGET, LocalTime.of(13, 0), LocalTime.of(16, 0));

        AvailabilityResult result = engine(UnknownStatusPolicy.AS_AVAILABLE).check(
                new SlotSearchRequest(List.of(ANN, BOB), TARGET, LocalTime.of(14, 0), 60, SearchHorizon.conflictRecovery(2)));

        assertEquals(AvailabilityResult.Outcome.CONFLICT, result.getOutcome());
        assertEquals(List.of(BOB), result.getConflictingParticipants());
        List<TimeSlotCandidate> alternatives = result.getAlternatives();
        assertFalse(alternatives.isEmpty());
        List<TimeSlotCandidate> sorted = new ArrayList<>(alternatives);
        sorted.sort(TimeSlotCandidate.SOONEST_FIRST);
        assertEquals(sorted, alternatives);
        for (TimeSlotCandidate slot : alternatives) {
            assertTrue(slot.getDate().isAfter(TARGET));
            assertFalse(slot.getDate().isAfter(TARGET.plusDays(2)));
        }
        assertEquals(LocalDateTime.of(TARGET.plusDays(1), LocalTime.of(9, 0)), alternatives.get(0).startDateTime());
    }

    @Test
    public void testSlotsStayInsideWorkingHoursAndAvoidBusyWindows() {
        calendar.busy(ANN, TARGET, LocalTime.of(9, 0), LocalTime.of(12, 0));
        calendar.busy(BOB, TARGET, LocalTime.of(15, 30), LocalTime.of(16, 0));

        List<TimeSlotCandidate> slots = engine(UnknownStatusPolicy.AS_AVAILABLE)
                .findSlots(List.of(ANN, BOB), TARGET, 90, SearchHorizon.singleDay());

        assertFalse(slots.isEmpty());
        for (TimeSlotCandidate slot : slots) {
            assertEquals(TARGET, slot.getDate());
            assertFalse(slot.getStartTime().isBefore(LocalTime.of(9, 0)));
            assertFalse(slot.getEndTime().isAfter(LocalTime.of(17, 0)));
            assertFalse(calendar.overlapsBusy(ANN, slot) || calendar.overlapsBusy(BOB, slot), slot.toString());
        }
        assertEquals(LocalTime.of(12, 0), slots.get(0).getStartTime());
        // Bob's 15:30 block rules out every later start
        assertEquals(LocalTime.of(14, 0), slots.get(slots.size() - 1).getStartTime());
    }

    @Test
    public void testNoSlotsWhenEveryoneIsBusy() {
        for (int day = 1; day <= 2; day++) {
            calendar.busy(ANN, TARGET.plusDays(day), LocalTime.of(0, 0), LocalTime.of(23, 59));
        }
        calendar.busy(ANN, TARGET, LocalTime.of(14, 0), LocalTime.of(15, 0));

        AvailabilityResult result = engine(UnknownStatusPolicy.AS_AVAILABLE).check(
                new SlotSearchRequest(List.of(ANN, BOB), TARGET, LocalTime.of(14, 0), 60, SearchHorizon.conflictRecovery(2)));

        assertEquals(AvailabilityResult.Outcome.CONFLICT, result.getOutcome());
        assertTrue(result.getAlternatives().isEmpty());
    }

    @Test
    public void testNoRequestedTimeSearchesTargetDay() {
        AvailabilityResult result = engine(UnknownStatusPolicy.AS_AVAILABLE).check(
                new SlotSearchRequest(List.of(ANN), TARGET, null, 60, SearchHorizon.singleDay()));

        assertEquals(AvailabilityResult.Outcome.SUGGESTIONS, result.getOutcome());
        // 9:00 through 16:00 in 30 minute steps
        assertEquals(15, result.getAlternatives().size());
        assertTrue(result.getAlternatives().stream().allMatch(slot -> slot.getDate().equals(TARGET)));
    }

    @Test
    public void testPastSlotsAreSkipped() {
        List<TimeSlotCandidate> slots = engine(UnknownStatusPolicy.AS_AVAILABLE)
                .findSlots(List.of(ANN), TODAY, 30, SearchHorizon.singleDay());

        assertEquals(LocalTime.of(10, 0), slots.get(0).getStartTime());
    }

    @Test
    public void testRequestInThePastIsAConflict() {
        AvailabilityResult result = engine(UnknownStatusPolicy.AS_AVAILABLE).check(
                new SlotSearchRequest(List.of(ANN), TODAY, LocalTime.of(9, 0), 30, SearchHorizon.conflictRecovery(2)));

        assertEquals(AvailabilityResult.Outcome.CONFLICT, result.getOutcome());
        assertTrue(result.getConflictingParticipants().isEmpty());
    }

    @Test
    public void testRequestPastMidnightIsAConflict() {
        calendar.busy(ANN, TARGET, LocalTime.of(23, 40), LocalTime.of(23, 59));

        AvailabilityResult result = engine(UnknownStatusPolicy.AS_AVAILABLE).check(
                new SlotSearchRequest(List.of(ANN), TARGET, LocalTime.of(23, 30), 60, SearchHorizon.conflictRecovery(2)));

        assertEquals(AvailabilityResult.Outcome.CONFLICT, result.getOutcome());
        assertNull(result.getAcceptedSlot());
        assertFalse(result.getAlternatives().isEmpty());
        for (TimeSlotCandidate slot : result.getAlternatives()) {
            assertTrue(slot.getStartTime().isBefore(slot.getEndTime()));
            assertFalse(slot.getEndTime().isAfter(LocalTime.of(17, 0)));
        }
    }

    @Test
    public void testRequestRunningPastEndOfDayIsAConflict() {
        AvailabilityResult result = engine(UnknownStatusPolicy.AS_AVAILABLE).check(
                new SlotSearchRequest(List.of(ANN, BOB), TARGET, LocalTime.of(16, 30), 120, SearchHorizon.conflictRecovery(2)));

        assertEquals(AvailabilityResult.Outcome.CONFLICT, result.getOutcome());
        assertTrue(result.getConflictingParticipants().isEmpty());
        assertFalse(result.getAlternatives().isEmpty());
        assertTrue(result.getAlternatives().stream()
                .noneMatch(slot -> slot.getEndTime().isAfter(LocalTime.of(17, 0))));
    }

    @Test
    public void testRequestBeforeStartOfDayIsAConflict() {
        AvailabilityResult result = engine(UnknownStatusPolicy.AS_AVAILABLE).check(
                new SlotSearchRequest(List.of(ANN), TARGET, LocalTime.of(7, 0), 60, SearchHorizon.conflictRecovery(2)));

        assertEquals(AvailabilityResult.Outcome.CONFLICT, result.getOutcome());
    }

    @Test
    public void testUnknownStatusPolicy() {
        SlotSearchRequest request =
                new SlotSearchRequest(List.of(ANN, GUEST), TARGET, LocalTime.of(10, 0), 60, SearchHorizon.conflictRecovery(2));

        AvailabilityResult lenient = engine(UnknownStatusPolicy.AS_AVAILABLE).check(request);
        assertEquals(AvailabilityResult.Outcome.ACCEPTED, lenient.getOutcome());
        // the guest is not confirmed free
        assertEquals(Set.of(ANN), lenient.getAcceptedSlot().getAvailableParticipants());

        AvailabilityResult strict = engine(UnknownStatusPolicy.AS_CONFLICT).check(request);
        assertEquals(AvailabilityResult.Outcome.CONFLICT, strict.getOutcome());
        assertEquals(List.of(GUEST), strict.getConflictingParticipants());
        assertTrue(strict.getAlternatives().isEmpty());
    }

    @Test
    public void testMissingStatusIsTreatedAsUnknown() {
        AvailabilityProvider empty = (emails, date, start, end) -> Map.of();
        AvailabilityEngine engine = new AvailabilityEngine(empty, LocalTime.of(9, 0), LocalTime.of(17, 0), 30,
                UnknownStatusPolicy.AS_CONFLICT, clock);

        assertTrue(engine.findSlots(List.of(ANN), TARGET, 60, SearchHorizon.singleDay()).isEmpty());
    }

    @Test
    public void testInvalidConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AvailabilityEngine(calendar,
                LocalTime.of(17, 0), LocalTime.of(9, 0), 30, UnknownStatusPolicy.AS_AVAILABLE, clock));
        assertThrows(IllegalArgumentException.class, () -> new AvailabilityEngine(calendar,
                LocalTime.of(9, 0), LocalTime.of(17, 0), 0, UnknownStatusPolicy.AS_AVAILABLE, clock));
    }

    /**
     * Calendar for a fixed set of known people; anybody else is unknown.
     */
    private static class FakeCalendar implements AvailabilityProvider {

        private final Set<String> known;
        private final Map<String, List<LocalDateTime[]>> busy = new LinkedHashMap<>();

        FakeCalendar(Set<String> known) {
            this.known = known;
        }

        void busy(String email, LocalDate date, LocalTime start, LocalTime end) {
            busy.computeIfAbsent(email, k -> new ArrayList<>())
                    .add(new LocalDateTime[]{LocalDateTime.of(date, start), LocalDateTime.of(date, end)});
        }

        boolean overlapsBusy(String email, TimeSlotCandidate slot) {
            LocalDateTime start = slot.startDateTime();
            LocalDateTime end = LocalDateTime.of(slot.getDate(), slot.getEndTime());
            return busy.getOrDefault(email, List.of()).stream()
                    .anyMatch(b -> start.isBefore(b[1]) && b[0].isBefore(end));
        }

        @Override
        public Map<String, AvailabilityStatus> getAvailability(List<String> emails, LocalDate date,
                                                               LocalTime start, LocalTime end) {
            Map<String, AvailabilityStatus> statuses = new LinkedHashMap<>();
            TimeSlotCandidate window = new TimeSlotCandidate(date, start, end, Set.of());
            for (String email : emails) {
                if (!known.contains(email)) {
                    statuses.put(email, AvailabilityStatus.UNKNOWN);
                } else {
                    statuses.put(email, overlapsBusy(email, window) ? AvailabilityStatus.BUSY : AvailabilityStatus.AVAILABLE);
                }
            }
            return statuses;
        }
    }
}
