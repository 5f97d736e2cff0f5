package com.adforge.core.job;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for job records.
 */
public interface JobStore {

    /** Creates a PENDING job. */
    JobRecord create(String type, ObjectNode payload);

    Optional<JobRecord> find(String jobId);

    /** Writes status, summary and error of an existing job. */
    JobRecord update(JobRecord job);

    /** Most recently created jobs first. */
    List<JobRecord> recent(int limit);
}
