/**
 * Conversation-level sequencing.
 *
 * Key classes:
 * - SchedulingOrchestrator: drives one conversation from request text to a stored meeting
 * - SchedulingContext: the per-conversation state it works on
 * - MeetingStore: the port scheduled meetings are saved through
 * - ConversationGateway: starts and signals conversation workflows for the REST layer
 */
package com.example.meetingscheduler.service;
