package com.example.meetingscheduler.controller;

import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.resolver.EntityResolver;
import com.example.meetingscheduler.resolver.ParticipantDirectory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/participants")
public class ParticipantController {

    static final int MAX_SUGGESTIONS = 10;

    private final EntityResolver entityResolver;
    private final ParticipantDirectory participantDirectory;

    public ParticipantController(EntityResolver entityResolver, ParticipantDirectory participantDirectory) {
        this.entityResolver = entityResolver;
        this.participantDirectory = participantDirectory;
    }

    /**
     * Autocomplete for the participant picker.
     */
    @GetMapping
    public List<ParticipantIdentity> suggest(@RequestParam("query") String query,
                                             @RequestParam(value = "limit", defaultValue = "5") int limit) {
        return entityResolver.suggest(query, Math.min(Math.max(limit, 1), MAX_SUGGESTIONS), participantDirectory);
    }
}
