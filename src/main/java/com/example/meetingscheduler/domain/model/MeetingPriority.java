package com.example.meetingscheduler.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MeetingPriority {
    @JsonProperty("low")
    LOW,

    @JsonProperty("medium")
    MEDIUM,

    @JsonProperty("high")
    HIGH,

    @JsonProperty("urgent")
    URGENT;

    public String label() {
        return name().toLowerCase();
    }
}
