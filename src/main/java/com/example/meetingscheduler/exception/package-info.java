/**
 * Failures that cross component boundaries.
 *
 * Parse errors never leave the parser and ambiguity or missing availability are ordinary
 * outcomes, so only validation and store failures are modelled as exceptions.
 */
package com.example.meetingscheduler.exception;
