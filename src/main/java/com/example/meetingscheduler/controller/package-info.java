/**
 * REST controllers for handling HTTP requests.
 * 
 * Controllers:
 * - ConversationController: Starts conversations, relays user actions, reports the latest reply
 * - ParticipantController: Participant autocomplete
 */
package com.example.meetingscheduler.controller;
