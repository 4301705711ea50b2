/**
 * Configuration classes for application setup.
 * 
 * Key configurations:
 * - TemporalConfig: Configures Temporal workflow client and worker
 * - SchedulingConfig: Directory, calendar and resolver beans
 * - SchedulingProperties / TemporalProperties: Settings bound from application.yml
 * 
 * These classes are responsible for setting up infrastructure
 * components and wiring the application together.
 */
package com.example.meetingscheduler.config;
