package com.example.meetingscheduler.workflow;

import com.example.meetingscheduler.config.SchedulingProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of a conversation workflow. The settings are copied in at start so a running conversation
 * is not affected by later configuration changes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationStart {
    private String initialMessage;
    private SchedulingProperties settings;
    private long idleTimeoutMinutes;
}
