package com.example.meetingscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "scheduler.temporal")
public class TemporalProperties {

    private String target = "127.0.0.1:7233";
    private String namespace = "default";
    private String taskQueue = "MeetingSchedulerTaskQueue";
    // turn off to run the REST API against a worker hosted elsewhere
    private boolean workerEnabled = true;
    private long idleTimeoutMinutes = 30;
}
