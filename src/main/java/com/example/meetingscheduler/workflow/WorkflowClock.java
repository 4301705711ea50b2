package com.example.meetingscheduler.workflow;

import io.temporal.workflow.Workflow;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * A {@link Clock} that reads Temporal's replay-safe workflow time. Only usable on a workflow thread.
 */
public class WorkflowClock extends Clock {

    private final ZoneId zone;

    public WorkflowClock(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new WorkflowClock(zone);
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(Workflow.currentTimeMillis());
    }
}
