package com.example.meetingscheduler.availability;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which days a slot search covers relative to the target date.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SearchHorizon {

    // 0 = start on the target date, 1 = start the day after
    private int firstDayOffset;
    private int days;

    /** The days after a conflicting request. */
    public static SearchHorizon conflictRecovery(int days) {
        return new SearchHorizon(1, days);
    }

    /** The days after the current draft when the user asks for another time. */
    public static SearchHorizon changeTime(int days) {
        return new SearchHorizon(1, days);
    }

    /** The target date only; used when no time was requested. */
    public static SearchHorizon singleDay() {
        return new SearchHorizon(0, 1);
    }
}
