package com.example.meetingscheduler.exception;

/**
 * Input supplied by the user that cannot be accepted, such as a malformed external email.
 * Surfaced to the user as-is and never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
