package com.adforge.core.job;

/**
 * Runs one kind of job. Implementations are Spring beans picked up by {@link JobRunner}.
 */
public interface JobHandler {

    /** Job type this handler serves. */
    String type();

    /**
     * Does the job's work. Any exception fails the job; its message becomes the job's error.
     */
    JobResult handle(JobRecord job) throws Exception;
}
