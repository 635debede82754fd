package io.usbjobs.core;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a persisted processing job.
 * This is a pure data object with no persistence logic.
 */
public record ProcessingJob(

        // identity
        long id,
        String jobToken,
        String orderRef,

        // work parameters
        String capacity,
        Map<String, Object> preferences,
        String contentPlanId,
        String volumeLabel,
        String assignedDeviceId,

        // progress
        JobStatus status,
        int progress,
        String failReason,

        // timestamps
        Instant startedAt,
        Instant finishedAt,
        Instant createdAt,
        Instant updatedAt,

        // lease
        String lockedBy,
        Instant lockedUntil,
        int attempts,
        String lastError
) {

    /**
     * A job has an active lease iff it has an owner and the expiry lies in the future.
     */
    public boolean hasActiveLease(Instant now) {
        return lockedBy != null && !lockedBy.isBlank()
                && lockedUntil != null && lockedUntil.isAfter(now);
    }

    public boolean isLeasedBy(String workerId, Instant now) {
        return hasActiveLease(now) && lockedBy.equals(workerId);
    }

    public JobStatusView statusView() {
        return new JobStatusView(status, progress, failReason);
    }
}
