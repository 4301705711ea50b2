/**
 * Adapters to the systems around the scheduler.
 * 
 * Key integrations:
 * - directory: In-memory company directory loaded from directory.json
 * - calendar: In-memory calendar with recurring and one-off busy blocks
 * - store: JPA-backed meeting store
 */
package com.example.meetingscheduler.integration;
