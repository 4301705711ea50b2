package com.example.meetingscheduler.config;

import com.example.meetingscheduler.workflow.MeetingSchedulingWorkflowImpl;
import com.example.meetingscheduler.workflow.activity.AvailabilityActivity;
import com.example.meetingscheduler.workflow.activity.DirectoryActivity;
import com.example.meetingscheduler.workflow.activity.MeetingStoreActivity;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.common.converter.DataConverter;
import io.temporal.common.converter.DefaultDataConverter;
import io.temporal.common.converter.JacksonJsonPayloadConverter;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TemporalConfig {

    private static final Logger logger = LoggerFactory.getLogger(TemporalConfig.class);

    /**
     * Jackson-based converter shared by the client, the worker and tests, so java.time values and
     * reply payloads round-trip the same way everywhere.
     */
    public static DataConverter dataConverter() {
        return DefaultDataConverter.newDefaultInstance()
                .withPayloadConverterOverrides(new JacksonJsonPayloadConverter(JsonMappers.temporalObjectMapper()));
    }

    @Bean
    public WorkflowServiceStubs workflowServiceStubs(TemporalProperties temporalProperties) {
        WorkflowServiceStubsOptions options = WorkflowServiceStubsOptions.newBuilder()
                .setTarget(temporalProperties.getTarget())
                .build();
        logger.info("Configuring WorkflowServiceStubs to target: {}", temporalProperties.getTarget());
        return WorkflowServiceStubs.newServiceStubs(options);
    }

    @Bean
    public WorkflowClient workflowClient(WorkflowServiceStubs serviceStubs, TemporalProperties temporalProperties) {
        logger.info("Configuring WorkflowClient for namespace {}", temporalProperties.getNamespace());
        return WorkflowClient.newInstance(serviceStubs, WorkflowClientOptions.newBuilder()
                .setNamespace(temporalProperties.getNamespace())
                .setDataConverter(dataConverter())
                .build());
    }

    @Bean
    public WorkerFactory workerFactory(WorkflowClient workflowClient) {
        logger.info("Configuring WorkerFactory");
        return WorkerFactory.newInstance(workflowClient);
    }

    @Bean
    @ConditionalOnProperty(prefix = "scheduler.temporal", name = "worker-enabled", havingValue = "true", matchIfMissing = true)
    public Worker conversationWorker(WorkerFactory workerFactory,
                                     TemporalProperties temporalProperties,
                                     DirectoryActivity directoryActivity,
                                     AvailabilityActivity availabilityActivity,
                                     MeetingStoreActivity meetingStoreActivity) {
        logger.info("Starting Temporal Worker Factory and registering components...");
        Worker worker = workerFactory.newWorker(temporalProperties.getTaskQueue());

        // Register Workflow Implementation
        worker.registerWorkflowImplementationTypes(MeetingSchedulingWorkflowImpl.class);
        logger.info("Registered workflow implementation: {}", MeetingSchedulingWorkflowImpl.class.getName());

        // Activity implementations are Spring beans so they can reach the directory, calendar and store
        worker.registerActivitiesImplementations(directoryActivity, availabilityActivity, meetingStoreActivity);

        workerFactory.start();
        logger.info("Temporal WorkerFactory started for task queue: {}", temporalProperties.getTaskQueue());
        return worker;
    }
}
