/**
 * Domain layer containing core business entities and repository interfaces.
 * 
 * This package contains:
 * - model: Core domain entities and value objects
 * - payload: Typed reply payloads rendered by the front end
 * - repository: Repository interfaces for data access
 */
package com.example.meetingscheduler.domain;
