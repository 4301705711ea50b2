package com.example.meetingscheduler.domain.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class ParticipantMatchesPayload implements AssistantPayload {
    private List<ParticipantPrompt> prompts = new ArrayList<>();
}
