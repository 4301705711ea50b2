package com.example.meetingscheduler.domain.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * One assistant turn: a message for the user plus any typed payloads to render with it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssistantReply {

    private ReplyType type;
    private String message;
    private List<AssistantPayload> payloads = new ArrayList<>();

    public static AssistantReply of(ReplyType type, String message, AssistantPayload... payloads) {
        return new AssistantReply(type, message, new ArrayList<>(Arrays.asList(payloads)));
    }

    public <T extends AssistantPayload> Optional<T> payload(Class<T> payloadType) {
        return payloads.stream()
                .filter(payloadType::isInstance)
                .map(payloadType::cast)
                .findFirst();
    }
}
