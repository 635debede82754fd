package io.usbjobs;

import io.usbjobs.core.JobSubmission;

/**
 * Fluent builder for a job submission.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory submission</li>
 *   <li>save(): build() + insert as a pending job</li>
 * </ul>
 */
public interface JobSubmissionBuilder {

    /**
     * Target capacity class, e.g. "32GB". Required.
     */
    JobSubmissionBuilder capacity(String capacity);

    /**
     * Free-form preferences payload. Any Jackson-convertible object; stored as a map and never interpreted here.
     */
    JobSubmissionBuilder preferences(Object preferences);

    JobSubmissionBuilder contentPlan(String contentPlanId);

    JobSubmissionBuilder volumeLabel(String volumeLabel);

    JobSubmissionBuilder assignedDevice(String deviceId);

    /**
     * Override the generated external job token.
     */
    JobSubmissionBuilder jobToken(String jobToken);

    JobSubmission build();

    /**
     * Build + persist.
     *
     * @return the durable job id
     */
    long save();
}
