package com.example.meetingscheduler;

import com.example.meetingscheduler.config.SchedulingProperties;
import com.example.meetingscheduler.config.TemporalProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({SchedulingProperties.class, TemporalProperties.class})
public class MeetingSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetingSchedulerApplication.class, args);
    }
}
