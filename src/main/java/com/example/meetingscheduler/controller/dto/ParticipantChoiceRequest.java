package com.example.meetingscheduler.controller.dto;

import lombok.Data;

/**
 * The user's answer for one participant query: a directory email, or an outside address.
 */
@Data
public class ParticipantChoiceRequest {
    private String query;
    private String email;
}
