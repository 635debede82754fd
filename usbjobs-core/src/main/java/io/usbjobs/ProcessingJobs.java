package io.usbjobs;

import io.usbjobs.core.JobLogEntry;
import io.usbjobs.core.JobStatusView;

import java.util.Map;
import java.util.Optional;

/**
 * Collaborator-facing entry point of the job pipeline.
 *
 * <p>Typical usage:
 * <pre>{@code
 * jobs.start();
 *
 * long id = jobs.create("order-1042")
 *       .capacity("64GB")
 *       .preferences(Map.of("genres", List.of("salsa", "rock")))
 *       .volumeLabel("MUSICA")
 *       .save();
 *
 * jobs.status(id).ifPresent(s -> log.info("{} {}%", s.status(), s.progress()));
 * jobs.stop();
 * }</pre>
 */
public interface ProcessingJobs {

    /**
     * Start the local worker, if one is configured. Idempotent.
     */
    void start();

    /**
     * Stop the local worker gracefully. Idempotent.
     */
    void stop();

    /**
     * Create a submission builder. Nothing is persisted until {@code save()} is called.
     */
    JobSubmissionBuilder create(String orderRef);

    /**
     * Create and persist a pending job.
     *
     * @return the durable job id
     */
    long submit(String orderRef, String capacity, Map<String, Object> preferences);

    Optional<JobStatusView> status(long jobId);

    void appendLog(long jobId, JobLogEntry entry);

    /**
     * Cancel a job that is still waiting (pending or retry, not leased).
     *
     * @return true when the job was canceled
     */
    boolean cancel(long jobId);
}
