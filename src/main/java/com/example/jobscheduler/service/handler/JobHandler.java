package com.example.jobscheduler.service.handler;

/**
 * Unit of work run by a scheduled job.
 * <p>
 * Handlers should:
 * - Be safe to run concurrently when the job allows more than one instance
 * - Respond to interruption, which is how a forced shutdown reaches them
 * - Signal failure by throwing
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Run the job once
     *
     * @param context Details of the current invocation
     * @throws Exception any failure, reported to listeners as an error outcome
     */
    void execute(JobExecutionContext context) throws Exception;
}
