package com.example.meetingscheduler.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MeetingStatus {
    @JsonProperty("draft")
    DRAFT,

    @JsonProperty("scheduled")
    SCHEDULED, // handed to the meeting store

    @JsonProperty("cancelled")
    CANCELLED
}
