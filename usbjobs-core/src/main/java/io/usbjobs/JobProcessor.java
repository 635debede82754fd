package io.usbjobs;

/**
 * Work performed for a leased job.
 *
 * <p>Returning normally completes the job. Throwing marks the attempt as failed; the worker decides
 * between retry and terminal failure.
 */
public interface JobProcessor {

    void process(JobExecutionContext context) throws Exception;
}
