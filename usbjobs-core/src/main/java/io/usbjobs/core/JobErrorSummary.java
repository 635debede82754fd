package io.usbjobs.core;

import java.util.Map;

/**
 * Error-level log entries of one job.
 *
 * total       : number of error entries
 * byCategory  : error entries per category, most frequent first
 * byErrorCode : error entries per error code (entries without a code are not counted here)
 */
public record JobErrorSummary(
        long total,
        Map<String, Long> byCategory,
        Map<String, Long> byErrorCode
) {

    public static JobErrorSummary empty() {
        return new JobErrorSummary(0, Map.of(), Map.of());
    }
}
