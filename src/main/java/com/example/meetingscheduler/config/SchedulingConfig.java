package com.example.meetingscheduler.config;

import com.example.meetingscheduler.availability.AvailabilityProvider;
import com.example.meetingscheduler.integration.calendar.InMemoryCalendarProvider;
import com.example.meetingscheduler.integration.directory.InMemoryParticipantDirectory;
import com.example.meetingscheduler.resolver.EntityResolver;
import com.example.meetingscheduler.resolver.ParticipantDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

/**
 * Wires the in-memory directory and calendar, plus the pieces the REST layer uses directly.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock schedulingClock(SchedulingProperties schedulingProperties) {
        return Clock.system(schedulingProperties.zoneId());
    }

    @Bean
    public ParticipantDirectory participantDirectory(ObjectMapper objectMapper,
                                                     @Value("${scheduler.data.directory:classpath:directory.json}") Resource resource)
            throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return InMemoryParticipantDirectory.fromJson(in, objectMapper);
        }
    }

    @Bean
    public AvailabilityProvider availabilityProvider(ParticipantDirectory participantDirectory, ObjectMapper objectMapper,
                                                     @Value("${scheduler.data.calendar:classpath:calendar.json}") Resource resource)
            throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return InMemoryCalendarProvider.fromJson(participantDirectory, in, objectMapper);
        }
    }

    @Bean
    public EntityResolver entityResolver() {
        return new EntityResolver();
    }
}
