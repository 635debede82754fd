package io.usbjobs.core;

/**
 * What collaborators see when they ask about a job.
 */
public record JobStatusView(
        JobStatus status,
        int progress,
        String failReason
) {
}
