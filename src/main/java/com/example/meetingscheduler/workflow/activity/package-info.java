/**
 * Temporal activities: the only places a conversation touches the directory, the calendar or
 * the meeting store.
 * 
 * Activities:
 * - DirectoryActivity: Participant listing, lookup and search
 * - AvailabilityActivity: Per-participant calendar status for a window
 * - MeetingStoreActivity: Saving a scheduled meeting
 *
 * Implementations live in the impl sub-package and are Spring beans registered with the worker.
 */
package com.example.meetingscheduler.workflow.activity;
