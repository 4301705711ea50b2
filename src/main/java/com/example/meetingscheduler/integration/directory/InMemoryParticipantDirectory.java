package com.example.meetingscheduler.integration.directory;

import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.resolver.ParticipantDirectory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Company directory held in memory, loaded from a JSON array of participants.
 */
public class InMemoryParticipantDirectory implements ParticipantDirectory {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryParticipantDirectory.class);

    private final List<ParticipantIdentity> participants;

    public InMemoryParticipantDirectory(List<ParticipantIdentity> participants) {
        this.participants = Collections.unmodifiableList(new ArrayList<>(participants));
    }

    public static InMemoryParticipantDirectory fromJson(InputStream json, ObjectMapper objectMapper) {
        try {
            List<ParticipantIdentity> loaded = objectMapper.readValue(json, new TypeReference<List<ParticipantIdentity>>() {});
            logger.info("Loaded {} directory entries", loaded.size());
            return new InMemoryParticipantDirectory(loaded);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read participant directory", e);
        }
    }

    @Override
    public List<ParticipantIdentity> listParticipants() {
        return participants;
    }

    @Override
    public Optional<ParticipantIdentity> getByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return participants.stream()
                .filter(p -> p.getEmail().equalsIgnoreCase(email.trim()))
                .findFirst();
    }

    @Override
    public List<ParticipantIdentity> search(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<ParticipantIdentity> results = new ArrayList<>();
        // an exact email hit goes first
        getByEmail(needle).ifPresent(results::add);
        for (ParticipantIdentity participant : participants) {
            if (results.size() >= limit) {
                break;
            }
            boolean matches = participant.getDisplayName().toLowerCase(Locale.ROOT).contains(needle)
                    || participant.getEmail().toLowerCase(Locale.ROOT).contains(needle);
            if (matches && !results.contains(participant)) {
                results.add(participant);
            }
        }
        return results.size() > limit ? results.subList(0, limit) : results;
    }
}
