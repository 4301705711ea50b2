package com.example.meetingscheduler.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Availability of one participant for one evaluated window.
 */
public enum AvailabilityStatus {
    @JsonProperty("available")
    AVAILABLE,

    @JsonProperty("busy")
    BUSY,

    @JsonProperty("unknown")
    UNKNOWN
}
