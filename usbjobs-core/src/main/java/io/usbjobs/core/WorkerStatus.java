package io.usbjobs.core;

import java.time.Duration;
import java.util.Set;

/**
 * Point-in-time view of a worker.
 */
public record WorkerStatus(
        String workerId,
        WorkerState state,
        Set<Long> activeJobIds,
        int maxConcurrentJobs,
        Duration leaseDuration
) {

    public int activeJobs() {
        return activeJobIds.size();
    }
}
