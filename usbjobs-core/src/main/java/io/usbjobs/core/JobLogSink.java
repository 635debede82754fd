package io.usbjobs.core;

import java.time.Duration;
import java.util.List;

/**
 * Durable, append-only record of structured job events.
 *
 * <p>Written concurrently by every component; implementations must not lose or corrupt entries under
 * concurrent appends for the same job. Entries are only removed by the retention methods.
 */
public interface JobLogSink {

    void append(JobLogEntry entry);

    /**
     * Append several entries in one round trip.
     */
    void appendAll(List<JobLogEntry> entries);

    /**
     * Entries of one job, newest first.
     */
    List<JobLogEntry> findByJobId(long jobId, int limit);

    /**
     * Entries sharing a correlation id, oldest first, for end-to-end tracing.
     */
    List<JobLogEntry> findByCorrelationId(String correlationId, int limit);

    /**
     * Entries matching {@code filter}, newest first.
     */
    List<JobLogEntry> find(JobLogFilter filter, int limit);

    JobErrorSummary errorSummary(long jobId);

    long deleteByJobId(long jobId);

    /**
     * Retention: delete entries older than {@code age}.
     */
    long deleteOlderThan(Duration age);
}
