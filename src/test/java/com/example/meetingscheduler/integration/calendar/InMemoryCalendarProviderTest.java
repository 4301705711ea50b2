package com.example.meetingscheduler.integration.calendar;

import com.example.meetingscheduler.config.JsonMappers;
import com.example.meetingscheduler.domain.model.AvailabilityStatus;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.integration.directory.InMemoryParticipantDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryCalendarProviderTest {

    // a Tuesday
    private static final LocalDate TUESDAY = LocalDate.of(2025, 6, 10);

    private InMemoryParticipantDirectory directory;
    private InMemoryCalendarProvider calendar;

    @BeforeEach
    public void setUp() throws Exception {
        try (InputStream people = getClass().getClassLoader().getResourceAsStream("directory.json");
             InputStream blocks = getClass().getClassLoader().getResourceAsStream("calendar.json")) {
            directory = InMemoryParticipantDirectory.fromJson(people, JsonMappers.temporalObjectMapper());
            calendar = InMemoryCalendarProvider.fromJson(directory, blocks, JsonMappers.temporalObjectMapper());
        }
    }

    @Test
    public void testRecurringStandupBlocksMorning() {
        Map<String, AvailabilityStatus> statuses = calendar.getAvailability(
                List.of("john.smith@company.com", "mike.davis@company.com"), TUESDAY, LocalTime.of(9, 0), LocalTime.of(10, 0));

        assertEquals(AvailabilityStatus.BUSY, statuses.get("john.smith@company.com"));
        assertEquals(AvailabilityStatus.AVAILABLE, statuses.get("mike.davis@company.com"));
    }

    @Test
    public void testBlocksAreHalfOpen() {
        Map<String, AvailabilityStatus> statuses = calendar.getAvailability(
                List.of("john.smith@company.com"), TUESDAY, LocalTime.of(9, 30), LocalTime.of(10, 0));

        assertEquals(AvailabilityStatus.AVAILABLE, statuses.get("john.smith@company.com"));
    }

    @Test
    public void testBlocksOnlyApplyOnTheirDays() {
        String sarah = "sarah.johnson@company.com";
        LocalTime start = LocalTime.of(14, 0);
        LocalTime end = LocalTime.of(15, 0);

        assertEquals(AvailabilityStatus.BUSY, calendar.getAvailability(List.of(sarah), TUESDAY, start, end).get(sarah));
        assertEquals(AvailabilityStatus.AVAILABLE,
                calendar.getAvailability(List.of(sarah), TUESDAY.plusDays(1), start, end).get(sarah));
    }

    @Test
    public void testOneOffBlock() {
        String mike = "mike.davis@company.com";
        calendar.addBusyBlock("Mike.Davis@company.com", TUESDAY, LocalTime.of(16, 0), LocalTime.of(17, 0));

        assertEquals(AvailabilityStatus.BUSY,
                calendar.getAvailability(List.of(mike), TUESDAY, LocalTime.of(16, 30), LocalTime.of(17, 0)).get(mike));
        assertEquals(AvailabilityStatus.AVAILABLE,
                calendar.getAvailability(List.of(mike), TUESDAY.plusDays(7), LocalTime.of(16, 30), LocalTime.of(17, 0)).get(mike));
    }

    @Test
    public void testOutsidersAreUnknown() {
        InMemoryParticipantDirectory withGuest = new InMemoryParticipantDirectory(List.of(
                ParticipantIdentity.external("guest@partner.io", "Guest")));
        InMemoryCalendarProvider guestCalendar = new InMemoryCalendarProvider(withGuest, List.of(
                new InMemoryCalendarProvider.WeeklyBlock("guest@partner.io", List.of(DayOfWeek.TUESDAY), "09:00", "17:00", "Busy")));

        Map<String, AvailabilityStatus> statuses = guestCalendar.getAvailability(
                List.of("guest@partner.io", "stranger@elsewhere.org"), TUESDAY, LocalTime.of(10, 0), LocalTime.of(11, 0));

        assertEquals(AvailabilityStatus.UNKNOWN, statuses.get("guest@partner.io"));
        assertEquals(AvailabilityStatus.UNKNOWN, statuses.get("stranger@elsewhere.org"));
        assertEquals(List.of("guest@partner.io", "stranger@elsewhere.org"), List.copyOf(statuses.keySet()));
    }
}
