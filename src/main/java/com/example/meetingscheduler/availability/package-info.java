/**
 * Multi-participant slot search.
 *
 * {@link com.example.meetingscheduler.availability.AvailabilityEngine} only talks to an
 * {@link com.example.meetingscheduler.availability.AvailabilityProvider}; where the data comes
 * from (in-memory calendar, Temporal activity) is decided by the caller.
 */
package com.example.meetingscheduler.availability;
