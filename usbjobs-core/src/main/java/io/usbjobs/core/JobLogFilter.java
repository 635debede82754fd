package io.usbjobs.core;

import java.time.Instant;

/**
 * Match conditions for job log queries. Null fields are ignored.
 */
public record JobLogFilter(
        Long jobId,
        LogLevel level,
        String category,
        String errorCode,
        String correlationId,
        Instant from,
        Instant to
) {

    public static JobLogFilter forJob(long jobId) {
        return new JobLogFilter(jobId, null, null, null, null, null, null);
    }

    public JobLogFilter withLevel(LogLevel level) {
        return new JobLogFilter(jobId, level, category, errorCode, correlationId, from, to);
    }

    public JobLogFilter withCategory(String category) {
        return new JobLogFilter(jobId, level, category, errorCode, correlationId, from, to);
    }

    public JobLogFilter withErrorCode(String errorCode) {
        return new JobLogFilter(jobId, level, category, errorCode, correlationId, from, to);
    }
}
