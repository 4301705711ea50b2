/**
 * Assistant replies and the tagged payload kinds they carry.
 */
package com.example.meetingscheduler.domain.payload;
