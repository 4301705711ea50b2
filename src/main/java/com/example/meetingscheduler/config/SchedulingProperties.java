package com.example.meetingscheduler.config;

import com.example.meetingscheduler.availability.UnknownStatusPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Tunables for parsing thresholds and slot search, bound from {@code scheduler.scheduling.*}.
 *
 * <p>A copy travels with every conversation workflow, so times are kept as plain "HH:mm" strings.
 */
@Data
@ConfigurationProperties(prefix = "scheduler.scheduling")
public class SchedulingProperties {

    private String zone = "UTC";
    private String workdayStart = "09:00";
    private String workdayEnd = "17:00";
    private int slotMinutes = 30;
    private UnknownStatusPolicy unknownStatusPolicy = UnknownStatusPolicy.AS_AVAILABLE;
    private int conflictHorizonDays = 2;
    private int changeTimeHorizonDays = 3;
    private int defaultDurationMinutes = 60;
    private double minimumConfidence = 0.3;
    private int maxParticipantOptions = 5;
    private int maxPreviewSlots = 5;

    public LocalTime workdayStartTime() {
        return LocalTime.parse(workdayStart);
    }

    public LocalTime workdayEndTime() {
        return LocalTime.parse(workdayEnd);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
