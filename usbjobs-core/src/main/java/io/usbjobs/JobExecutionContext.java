package io.usbjobs;

import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.JobStatus;
import io.usbjobs.core.ProcessingJob;

/**
 * What a {@link JobProcessor} sees of the job it is running.
 *
 * <p>Every write goes through the worker's lease; once the lease is lost the writes are rejected and
 * {@link #isLeaseLost()} turns true.
 */
public interface JobExecutionContext {

    /**
     * Snapshot of the job as it was when the lease was acquired.
     */
    ProcessingJob job();

    String workerId();

    /**
     * @return false when the write was rejected because this worker no longer owns the job
     */
    boolean reportProgress(int progress);

    boolean reportProgress(int progress, String message);

    /**
     * Move the job to writing or verifying.
     */
    boolean advanceStatus(JobStatus status);

    /**
     * True once a renewal was refused. Processors should stop touching the destination as soon as they see it.
     */
    boolean isLeaseLost();

    JobLogWriter log();
}
