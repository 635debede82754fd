package io.usbjobs.core;

import java.util.Map;

/**
 * Aggregate counts over the job table.
 *
 * total               : number of jobs
 * byStatus            : number of jobs per status (absent statuses are omitted)
 * avgDurationMinutes  : mean started-to-finished time of done jobs, 0 when none
 */
public record JobStatistics(
        long total,
        Map<JobStatus, Long> byStatus,
        double avgDurationMinutes
) {

    public long count(JobStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }
}
