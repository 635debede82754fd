package io.usbjobs.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of job records: CRUD and status mapping only.
 *
 * <p>Lease fields are never written here; see {@link LeaseManager}.
 */
public interface JobStore {

    /**
     * Default page size for {@link #list(JobFilter, int)}.
     */
    int DEFAULT_LIMIT = 50;

    /**
     * Upper bound applied to every list limit.
     */
    int MAX_LIMIT = 200;

    /**
     * Insert a new job in {@link JobStatus#PENDING}.
     *
     * @return the durable integer id of the new job
     */
    long create(JobSubmission submission);

    Optional<ProcessingJob> findById(long id);

    Optional<ProcessingJob> findByJobToken(String jobToken);

    /**
     * Most recently created job for an order. A retried job reuses its record, so this is normally the only one.
     */
    Optional<ProcessingJob> findLatestByOrderRef(String orderRef);

    /**
     * List jobs newest first. {@code limit} is clamped to 1..{@link #MAX_LIMIT}.
     */
    List<ProcessingJob> list(JobFilter filter, int limit);

    JobStatistics statistics();

    /**
     * Jobs currently owned by some worker, soonest expiry first.
     */
    List<ProcessingJob> activeLeases();

    /**
     * Jobs whose owner let the lease lapse without releasing it, oldest expiry first.
     */
    List<ProcessingJob> expiredLeases();

    /**
     * Move a {@code pending|retry} job without an active lease to {@link JobStatus#CANCELED}.
     *
     * @return true when the job was canceled
     */
    boolean cancel(long id);

    /**
     * Retention: hard delete terminal jobs finished before {@code cutoff}.
     *
     * @return deleted count
     */
    long deleteFinishedBefore(Instant cutoff);

    static int clampLimit(int limit) {
        if (limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
