package io.usbjobs.core;

import java.util.Map;

/**
 * Immutable job submission produced by {@code JobSubmissionBuilder.build()}.
 * A job is always created in {@link JobStatus#PENDING}.
 */
public record JobSubmission(
        String jobToken,
        String orderRef,
        String capacity,
        Map<String, Object> preferences,
        String contentPlanId,
        String volumeLabel,
        String assignedDeviceId
) {
}
