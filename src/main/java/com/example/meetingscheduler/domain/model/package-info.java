/**
 * Domain model for meeting requests and the meetings they produce.
 * 
 * Key entities:
 * - ParsedRequest: Structured reading of one request utterance
 * - ParticipantIdentity: A person that can be invited, keyed by email
 * - ParticipantMatch: Ranked directory candidates for one name or email
 * - TimeSlotCandidate: A window when the participants are free
 * - MeetingDraft: The meeting being assembled in a conversation
 * - MeetingRecord: Persisted form of a scheduled meeting
 * - ConversationPhase: Where a conversation is waiting
 */
package com.example.meetingscheduler.domain.model;
