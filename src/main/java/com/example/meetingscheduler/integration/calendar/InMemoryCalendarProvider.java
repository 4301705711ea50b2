package com.example.meetingscheduler.integration.calendar;

import com.example.meetingscheduler.availability.AvailabilityProvider;
import com.example.meetingscheduler.domain.model.AvailabilityStatus;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.resolver.ParticipantDirectory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Calendar data held in memory: weekly recurring busy blocks from JSON plus one-off blocks added
 * at runtime. People outside the directory, and external guests, have no calendar here and are
 * reported as {@link AvailabilityStatus#UNKNOWN}.
 */
public class InMemoryCalendarProvider implements AvailabilityProvider {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCalendarProvider.class);

    private final ParticipantDirectory directory;
    private final List<WeeklyBlock> weeklyBlocks;
    private final List<OneOffBlock> oneOffBlocks = new CopyOnWriteArrayList<>();

    public InMemoryCalendarProvider(ParticipantDirectory directory, List<WeeklyBlock> weeklyBlocks) {
        this.directory = directory;
        this.weeklyBlocks = new ArrayList<>(weeklyBlocks);
    }

    public static InMemoryCalendarProvider fromJson(ParticipantDirectory directory, InputStream json,
                                                    ObjectMapper objectMapper) {
        try {
            List<WeeklyBlock> blocks = objectMapper.readValue(json, new TypeReference<List<WeeklyBlock>>() {});
            logger.info("Loaded {} recurring busy blocks", blocks.size());
            return new InMemoryCalendarProvider(directory, blocks);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read calendar data", e);
        }
    }

    public void addBusyBlock(String email, LocalDate date, LocalTime start, LocalTime end) {
        oneOffBlocks.add(new OneOffBlock(email.toLowerCase(Locale.ROOT), date, start, end));
        logger.debug("Added busy block for {} on {} {}-{}", email, date, start, end);
    }

    @Override
    public Map<String, AvailabilityStatus> getAvailability(List<String> emails, LocalDate date,
                                                           LocalTime start, LocalTime end) {
        Map<String, AvailabilityStatus> statuses = new LinkedHashMap<>();
        for (String email : emails) {
            statuses.put(email, statusOf(email, date, start, end));
        }
        return statuses;
    }

    private AvailabilityStatus statusOf(String email, LocalDate date, LocalTime start, LocalTime end) {
        ParticipantIdentity person = directory.getByEmail(email).orElse(null);
        if (person == null || person.isExternal()) {
            return AvailabilityStatus.UNKNOWN;
        }
        String key = email.toLowerCase(Locale.ROOT);
        boolean busy = weeklyBlocks.stream().anyMatch(b -> b.covers(key, date.getDayOfWeek())
                        && overlaps(b.startTime(), b.endTime(), start, end))
                || oneOffBlocks.stream().anyMatch(b -> b.email().equals(key) && b.date().equals(date)
                        && overlaps(b.start(), b.end(), start, end));
        return busy ? AvailabilityStatus.BUSY : AvailabilityStatus.AVAILABLE;
    }

    private static boolean overlaps(LocalTime busyStart, LocalTime busyEnd, LocalTime start, LocalTime end) {
        return start.isBefore(busyEnd) && busyStart.isBefore(end);
    }

    /**
     * A block that repeats every week on the given days, e.g. a daily standup.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WeeklyBlock {
        private String email;
        private List<DayOfWeek> days = new ArrayList<>();
        private String start;
        private String end;
        private String label;

        boolean covers(String lowerCaseEmail, DayOfWeek day) {
            return email.toLowerCase(Locale.ROOT).equals(lowerCaseEmail) && days.contains(day);
        }

        LocalTime startTime() {
            return LocalTime.parse(start);
        }

        LocalTime endTime() {
            return LocalTime.parse(end);
        }
    }

    private record OneOffBlock(String email, LocalDate date, LocalTime start, LocalTime end) {
    }
}
