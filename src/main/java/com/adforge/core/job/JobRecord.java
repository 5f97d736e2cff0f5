package com.adforge.core.job;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * A queued unit of pipeline work.
 *
 * @param id            job id
 * @param type          pipeline name, selects the handler
 * @param status        lifecycle status
 * @param payload       handler input
 * @param resultSummary single-line summary of a completed run
 * @param error         single-line failure summary
 */
public record JobRecord(
        String id,
        String type,
        JobStatus status,
        ObjectNode payload,
        String resultSummary,
        String error,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * Copy with a new status, checked against {@link JobStateMachine}.
     */
    public JobRecord transitionTo(JobStatus next, Instant at) {
        JobStateMachine.assertTransition(id, status, next);
        return new JobRecord(id, type, next, payload, resultSummary, error, createdAt, at);
    }

    public JobRecord completed(String summary, Instant at) {
        JobRecord next = transitionTo(JobStatus.COMPLETED, at);
        return new JobRecord(id, type, next.status(), payload, summary, null, createdAt, at);
    }

    public JobRecord failed(String message, Instant at) {
        JobRecord next = transitionTo(JobStatus.FAILED, at);
        return new JobRecord(id, type, next.status(), payload, resultSummary, message, createdAt, at);
    }
}
