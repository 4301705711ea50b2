package com.example.meetingscheduler.resolver;

/**
 * How a directory entry matched a name query. Declaration order is the ranking order.
 */
public enum NameMatchType {
    EXACT,
    FIRST_NAME,
    LAST_NAME,
    SUBSTRING,
    TOKEN_OVERLAP
}
