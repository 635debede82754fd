package io.usbjobs.execution;

import io.usbjobs.core.ProcessingJob;

/**
 * Supplies the files for a job. Content selection and device mounting live outside the pipeline;
 * this is the seam they plug into.
 */
public interface ContentPlanResolver {

    ContentPlan resolve(ProcessingJob job) throws Exception;
}
