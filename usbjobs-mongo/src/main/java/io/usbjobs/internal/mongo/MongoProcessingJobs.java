package io.usbjobs.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.usbjobs.JobSubmissionBuilder;
import io.usbjobs.ProcessingJobs;
import io.usbjobs.core.JobLogEntry;
import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.JobStatusView;
import io.usbjobs.core.JobStore;
import io.usbjobs.core.ProcessingJob;
import io.usbjobs.core.WorkerStatus;
import io.usbjobs.internal.ProcessingWorker;
import io.usbjobs.internal.SimpleJobSubmissionBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mongo-backed {@link ProcessingJobs}.
 *
 * <p>Submission, status and cancel go straight to the store. The worker is optional: a node that only
 * submits jobs runs without one, and {@link #start()}/{@link #stop()} are then no-ops.
 */
public class MongoProcessingJobs implements ProcessingJobs {
    private static final Logger log = LoggerFactory.getLogger(MongoProcessingJobs.class);

    private final JobStore jobStore;
    private final JobLogWriter jobLog;
    private final ObjectMapper objectMapper;
    private final ProcessingWorker worker;

    public MongoProcessingJobs(JobStore jobStore, JobLogWriter jobLog, ObjectMapper objectMapper,
                               ProcessingWorker worker) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobLog = Objects.requireNonNull(jobLog, "jobLog must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.worker = worker;
    }

    @Override
    public void start() {
        if (worker == null) {
            log.info("usbjobs no job processor configured, running submit-only");
            return;
        }
        worker.start();
    }

    @Override
    public void stop() {
        if (worker != null) {
            worker.stop();
        }
    }

    @Override
    public JobSubmissionBuilder create(String orderRef) {
        return new SimpleJobSubmissionBuilder(orderRef, objectMapper, jobStore::create);
    }

    @Override
    public long submit(String orderRef, String capacity, Map<String, Object> preferences) {
        return create(orderRef)
                .capacity(capacity)
                .preferences(preferences)
                .save();
    }

    @Override
    public Optional<JobStatusView> status(long jobId) {
        return jobStore.findById(jobId).map(ProcessingJob::statusView);
    }

    @Override
    public void appendLog(long jobId, JobLogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (entry.jobId() != jobId) {
            throw new IllegalArgumentException("entry belongs to job " + entry.jobId() + ", not " + jobId);
        }
        jobLog.write(entry);
    }

    @Override
    public boolean cancel(long jobId) {
        return jobStore.cancel(jobId);
    }

    public Optional<WorkerStatus> workerStatus() {
        return Optional.ofNullable(worker).map(ProcessingWorker::status);
    }

    public JobStore store() {
        return jobStore;
    }
}
