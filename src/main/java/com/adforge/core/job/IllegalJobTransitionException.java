package com.adforge.core.job;

/**
 * Raised for any job status change the state machine does not allow.
 */
public class IllegalJobTransitionException extends IllegalStateException {

    private final JobStatus from;
    private final JobStatus to;

    public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + ": illegal transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public JobStatus from() {
        return from;
    }

    public JobStatus to() {
        return to;
    }
}
