/**
 * Temporal workflow definitions and implementations.
 * 
 * This package contains:
 * - MeetingSchedulingWorkflow: One conversation, driven by signals and read through queries
 * - MeetingSchedulingWorkflowImpl: Runs the scheduling orchestrator on the workflow thread
 * - ActivityBacked*: Directory, calendar and store adapters that call activities
 * - activity: Temporal activities used by workflows
 * 
 * All parsing, matching and slot search happens inside the workflow against a replay-safe
 * clock; only provider calls leave it as activities.
 */
package com.example.meetingscheduler.workflow;
