package io.usbjobs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.usbjobs.JobProcessor;
import io.usbjobs.ProcessingJobs;
import io.usbjobs.core.JobLogSink;
import io.usbjobs.core.JobStore;
import io.usbjobs.core.LeaseManager;
import io.usbjobs.core.WorkerState;
import io.usbjobs.execution.ContentPlanResolver;
import io.usbjobs.execution.UsbWriteProcessor;
import io.usbjobs.internal.mongo.MongoProcessingJobs;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class UsbJobsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(UsbJobsAutoConfiguration.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "usbjobs.worker-id=test-worker",
                    "usbjobs.poll-interval=500ms",
                    "usbjobs.lease-duration=10s",
                    "usbjobs.shutdown-grace-period=1s"
            );

    @Test
    void shouldAutoConfigureSubmitOnlyNodeWithoutPlanResolver() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ProcessingJobs.class);
            assertThat(context).hasSingleBean(UsbJobsLifecycle.class);
            assertThat(context).hasSingleBean(UsbJobsProperties.class);
            assertThat(context).hasSingleBean(JobStore.class);
            assertThat(context).hasSingleBean(LeaseManager.class);
            assertThat(context).hasSingleBean(JobLogSink.class);
            assertThat(context).doesNotHaveBean(JobProcessor.class);

            MongoProcessingJobs jobs = context.getBean(MongoProcessingJobs.class);
            assertThat(jobs.workerStatus()).isEmpty();
        });
    }

    @Test
    void shouldStartWorkerWhenPlanResolverIsPresent() {
        contextRunner
                .withBean(ContentPlanResolver.class, () -> mock(ContentPlanResolver.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(UsbWriteProcessor.class);

                    MongoProcessingJobs jobs = context.getBean(MongoProcessingJobs.class);
                    assertThat(jobs.workerStatus()).hasValueSatisfying(status -> {
                        assertThat(status.workerId()).isEqualTo("test-worker");
                        assertThat(status.state()).isEqualTo(WorkerState.RUNNING);
                        assertThat(status.leaseDuration()).isEqualTo(Duration.ofSeconds(10));
                    });
                });
    }

    @Test
    void shouldPreferApplicationProcessor() {
        JobProcessor custom = ctx -> ctx.reportProgress(100, "done");
        contextRunner
                .withBean(ContentPlanResolver.class, () -> mock(ContentPlanResolver.class))
                .withBean(JobProcessor.class, () -> custom)
                .run(context -> {
                    assertThat(context).doesNotHaveBean(UsbWriteProcessor.class);
                    assertThat(context.getBean(JobProcessor.class)).isSameAs(custom);
                });
    }

    @Test
    void shouldRejectInvalidProperties() {
        contextRunner
                .withBean(ContentPlanResolver.class, () -> mock(ContentPlanResolver.class))
                .withPropertyValues("usbjobs.lease-extension-threshold-percent=150")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("usbjobs.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ProcessingJobs.class);
                    assertThat(context).doesNotHaveBean(UsbJobsLifecycle.class);
                });
    }
}
