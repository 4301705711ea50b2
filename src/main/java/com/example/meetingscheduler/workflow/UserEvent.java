package com.example.meetingscheduler.workflow;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One user action received as a signal, queued until the workflow loop gets to it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserEvent {

    public enum Type {
        MESSAGE,
        CONFIRM_PARTICIPANT,
        ADD_EXTERNAL_PARTICIPANT,
        SELECT_SLOT,
        SCHEDULE,
        CHANGE_TIME,
        CANCEL
    }

    private Type type;
    private String text;
    private String query;
    private String email;
    private int slotIndex;

    public static UserEvent of(Type type) {
        return new UserEvent(type, null, null, null, 0);
    }
}
