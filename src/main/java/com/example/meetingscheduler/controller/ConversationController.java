package com.example.meetingscheduler.controller;

import com.example.meetingscheduler.controller.dto.ConversationView;
import com.example.meetingscheduler.controller.dto.MessageRequest;
import com.example.meetingscheduler.controller.dto.ParticipantChoiceRequest;
import com.example.meetingscheduler.controller.dto.SlotSelectionRequest;
import com.example.meetingscheduler.service.ConversationGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * REST front for scheduling conversations. Actions are delivered as workflow signals and handled
 * asynchronously; clients read the outcome with {@code GET /{id}}.
 */
@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationController {

    private static final Logger logger = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationGateway conversationGateway;

    public ConversationController(ConversationGateway conversationGateway) {
        this.conversationGateway = conversationGateway;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> startConversation(@RequestBody(required = false) MessageRequest request) {
        String message = request != null ? request.getMessage() : null;
        logger.info("Received request to start conversation with message: '{}'", message);
        try {
            String conversationId = conversationGateway.startConversation(message);
            Map<String, String> response = new HashMap<>();
            response.put("conversationId", conversationId);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error starting conversation", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to start conversation: " + e.getMessage());
        }
    }

    @PostMapping("/{id}/messages")
    public ResponseEntity<Map<String, String>> sendMessage(@PathVariable("id") String id, @RequestBody MessageRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "message must not be empty");
        }
        return signal(id, "submitMessage", () -> conversationGateway.sendMessage(id, request.getMessage()));
    }

    @PostMapping("/{id}/participants/confirm")
    public ResponseEntity<Map<String, String>> confirmParticipant(@PathVariable("id") String id,
                                                                  @RequestBody ParticipantChoiceRequest request) {
        if (request.getQuery() == null || request.getEmail() == null) {
            return error(HttpStatus.BAD_REQUEST, "query and email are required");
        }
        return signal(id, "confirmParticipant",
                () -> conversationGateway.confirmParticipant(id, request.getQuery(), request.getEmail()));
    }

    @PostMapping("/{id}/participants/external")
    public ResponseEntity<Map<String, String>> addExternalParticipant(@PathVariable("id") String id,
                                                                      @RequestBody ParticipantChoiceRequest request) {
        if (request.getQuery() == null) {
            return error(HttpStatus.BAD_REQUEST, "query is required");
        }
        return signal(id, "addExternalParticipant",
                () -> conversationGateway.addExternalParticipant(id, request.getQuery(), request.getEmail()));
    }

    @PostMapping("/{id}/slots/select")
    public ResponseEntity<Map<String, String>> selectSlot(@PathVariable("id") String id,
                                                          @RequestBody SlotSelectionRequest request) {
        if (request.getIndex() == null) {
            return error(HttpStatus.BAD_REQUEST, "index is required");
        }
        return signal(id, "selectSlot", () -> conversationGateway.selectSlot(id, request.getIndex()));
    }

    @PostMapping("/{id}/schedule")
    public ResponseEntity<Map<String, String>> schedule(@PathVariable("id") String id) {
        return signal(id, "scheduleMeeting", () -> conversationGateway.scheduleMeeting(id));
    }

    @PostMapping("/{id}/change-time")
    public ResponseEntity<Map<String, String>> changeTime(@PathVariable("id") String id) {
        return signal(id, "changeTime", () -> conversationGateway.changeTime(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable("id") String id) {
        return signal(id, "cancel", () -> conversationGateway.cancel(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getConversation(@PathVariable("id") String id) {
        try {
            ConversationView view = new ConversationView(id,
                    conversationGateway.phase(id),
                    conversationGateway.latestReply(id),
                    conversationGateway.draft(id));
            return ResponseEntity.ok(view);
        } catch (Exception e) {
            logger.error("Error querying conversation {}", id, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to query conversation: " + e.getMessage());
        }
    }

    private ResponseEntity<Map<String, String>> signal(String id, String signalName, Runnable action) {
        try {
            action.run();
            logger.info("Signal {} sent successfully to conversation {}", signalName, id);
            Map<String, String> response = new HashMap<>();
            response.put("message", "Signal " + signalName + " sent to " + id);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error sending signal {} to conversation {}", signalName, id, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to send signal: " + e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("error", message);
        return ResponseEntity.status(status).body(response);
    }
}
