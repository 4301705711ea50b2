/**
 * Meeting persistence through Spring Data JPA.
 */
package com.example.meetingscheduler.integration.store;
