package com.example.meetingscheduler.exception;

/**
 * The meeting store did not accept a draft. The draft stays unsaved; saving it again with the
 * same draft id is safe.
 */
public class StoreFailureException extends RuntimeException {

    private final String draftId;

    public StoreFailureException(String draftId, String message) {
        super(message);
        this.draftId = draftId;
    }

    public StoreFailureException(String draftId, String message, Throwable cause) {
        super(message, cause);
        this.draftId = draftId;
    }

    public String getDraftId() {
        return draftId;
    }
}
