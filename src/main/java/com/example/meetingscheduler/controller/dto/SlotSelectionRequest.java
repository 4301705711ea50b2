package com.example.meetingscheduler.controller.dto;

import lombok.Data;

@Data
public class SlotSelectionRequest {
    // zero-based position in the suggestion list
    private Integer index;
}
