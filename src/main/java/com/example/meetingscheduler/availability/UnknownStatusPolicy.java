package com.example.meetingscheduler.availability;

/**
 * How a participant with no availability data is treated during slot search.
 */
public enum UnknownStatusPolicy {
    /** Free but unconfirmed: the slot is offered, the participant is not listed as confirmed. */
    AS_AVAILABLE,
    /** A soft conflict: the slot is not offered. */
    AS_CONFLICT
}
