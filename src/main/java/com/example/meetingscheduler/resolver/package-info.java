/**
 * Participant lookup: turning name and email tokens into ranked directory candidates.
 */
package com.example.meetingscheduler.resolver;
