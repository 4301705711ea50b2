/**
 * Spring Data JPA repositories for persisted meetings.
 */
package com.example.meetingscheduler.domain.repository;
