package io.usbjobs;

import io.usbjobs.core.ProcessingJob;

/**
 * Observer of worker activity. Each callback fires after the matching state change has been stored.
 * Callbacks run on worker threads and must not block.
 */
public interface JobEventListener {

    default void workerStarted(String workerId) {
    }

    default void workerStopped(String workerId) {
    }

    default void jobStarted(ProcessingJob job) {
    }

    default void jobCompleted(ProcessingJob job) {
    }

    default void jobFailed(ProcessingJob job, Throwable error) {
    }

    default void leaseLost(ProcessingJob job) {
    }
}
