package io.usbjobs.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Grants mutually-exclusive, time-bounded ownership of jobs to workers.
 *
 * <p>Contract:
 * <ul>
 *   <li>At most one worker holds an unexpired lease on a job at any instant.</li>
 *   <li>{@code attempts} only grows, once per successful acquisition.</li>
 *   <li>A job whose attempts reached {@link #maxAttempts()} is never acquired again.</li>
 *   <li>Ownership failures are reported as {@code false}, never as exceptions. A caller that gets
 *       {@code false} must stop working on the job.</li>
 * </ul>
 * Storage failures propagate as unchecked exceptions and leave the store unchanged.
 */
public interface LeaseManager {

    /**
     * Atomically select the oldest acquirable job (status pending/retry, lease absent or expired,
     * attempts below the ceiling) and mark it owned by {@code workerId}.
     *
     * @return the leased job with status {@link JobStatus#PROCESSING}, or empty when nothing is eligible
     */
    Optional<ProcessingJob> acquireLease(String workerId, Duration leaseDuration);

    /**
     * Push the lease expiry to {@code now + additional}, only if {@code workerId} still holds an unexpired lease.
     */
    boolean extendLease(long jobId, String workerId, Duration additional);

    /**
     * Clear the lease and set {@code finalStatus}, only if {@code workerId} is the current owner.
     * Terminal statuses also set {@code finishedAt}.
     *
     * @param error failure message stored as the job's last error; may be null
     */
    boolean releaseLease(long jobId, String workerId, JobStatus finalStatus, String error);

    /**
     * Reclaim jobs left in {@code processing} with a lapsed lease: back to {@code retry} below the ceiling,
     * {@code failed} at the ceiling. Idempotent and safe to run concurrently with itself and with acquisition.
     *
     * @return number of jobs reset
     */
    int resetExpiredLeases();

    /**
     * Record progress (0..100) for a job the caller owns.
     *
     * @param message optional progress note appended to the job log
     */
    boolean reportProgress(long jobId, String workerId, int progress, String message);

    /**
     * Move an owned job between the active states (processing, writing, verifying).
     * Terminal states are only reachable through {@link #releaseLease}.
     */
    boolean advanceStatus(long jobId, String workerId, JobStatus status);

    /**
     * The attempt ceiling.
     */
    int maxAttempts();
}
