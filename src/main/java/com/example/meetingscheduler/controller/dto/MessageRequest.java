package com.example.meetingscheduler.controller.dto;

import lombok.Data;

@Data
public class MessageRequest {
    private String message;
}
