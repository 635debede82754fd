package io.usbjobs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.usbjobs.JobEventListener;
import io.usbjobs.JobProcessor;
import io.usbjobs.ProcessingJobs;
import io.usbjobs.core.JobLogSink;
import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.JobStore;
import io.usbjobs.core.LeaseManager;
import io.usbjobs.execution.ContentPlanResolver;
import io.usbjobs.execution.ExecutionEngine;
import io.usbjobs.execution.UsbWriteProcessor;
import io.usbjobs.internal.ProcessingWorker;
import io.usbjobs.internal.mongo.MongoJobLogSink;
import io.usbjobs.internal.mongo.MongoJobStore;
import io.usbjobs.internal.mongo.MongoLeaseManager;
import io.usbjobs.internal.mongo.MongoProcessingJobs;
import io.usbjobs.internal.mongo.MongoSequenceGenerator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the USB job pipeline.
 *
 * <p>The worker is only created when a {@link JobProcessor} is available, either supplied by the
 * application or built from a {@link ContentPlanResolver}. Without one the node can still submit and
 * inspect jobs.
 */
@AutoConfiguration
@ConditionalOnClass({ProcessingJobs.class, MongoTemplate.class})
@EnableConfigurationProperties(UsbJobsProperties.class)
@ConditionalOnProperty(prefix = "usbjobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class UsbJobsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    protected MongoSequenceGenerator mongoSequenceGenerator(MongoTemplate mongoTemplate) {
        return new MongoSequenceGenerator(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(JobLogSink.class)
    public MongoJobLogSink mongoJobLogSink(MongoTemplate mongoTemplate) {
        return new MongoJobLogSink(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobLogWriter jobLogWriter(JobLogSink sink) {
        return new JobLogWriter(sink);
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    public MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, MongoSequenceGenerator sequences,
                                       JobLogWriter jobLog) {
        return new MongoJobStore(mongoTemplate, sequences, jobLog);
    }

    @Bean
    @ConditionalOnMissingBean(LeaseManager.class)
    public MongoLeaseManager mongoLeaseManager(MongoTemplate mongoTemplate, JobLogWriter jobLog,
                                               UsbJobsProperties props) {
        return new MongoLeaseManager(mongoTemplate, jobLog, props.getMaxAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    protected UsbJobsMongoIndexConfig usbJobsMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new UsbJobsMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ContentPlanResolver.class)
    public ExecutionEngine executionEngine(JobLogWriter jobLog) {
        return new ExecutionEngine(jobLog);
    }

    @Bean
    @ConditionalOnMissingBean(JobProcessor.class)
    @ConditionalOnBean(ContentPlanResolver.class)
    public UsbWriteProcessor usbWriteProcessor(ContentPlanResolver resolver, ExecutionEngine engine,
                                               UsbJobsProperties props) {
        return new UsbWriteProcessor(resolver, engine, props.getVerification().toConfig(), props.isAllowPartialCopy());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessingJobs processingJobs(JobStore jobStore,
                                         JobLogWriter jobLog,
                                         LeaseManager leaseManager,
                                         UsbJobsProperties props,
                                         ObjectProvider<JobProcessor> processorProvider,
                                         ObjectProvider<JobEventListener> listenersProvider,
                                         ObjectProvider<ObjectMapper> objectMapperProvider) {
        JobProcessor processor = processorProvider.getIfUnique();
        ProcessingWorker worker = null;
        if (processor != null) {
            List<JobEventListener> listeners = listenersProvider.orderedStream().toList();
            worker = new ProcessingWorker(props, leaseManager, processor, jobLog, listeners);
        }
        ObjectMapper om = objectMapperProvider.getIfAvailable(ObjectMapper::new);
        return new MongoProcessingJobs(jobStore, jobLog, om, worker);
    }

    @Bean
    @ConditionalOnMissingBean
    public UsbJobsLifecycle usbJobsLifecycle(ProcessingJobs processingJobs) {
        return new UsbJobsLifecycle(processingJobs);
    }

    @Bean
    @ConditionalOnProperty(prefix = "usbjobs", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton usbJobsIndexesInitializer(UsbJobsMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
