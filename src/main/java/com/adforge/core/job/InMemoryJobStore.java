package com.adforge.core.job;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local {@link JobStore}, used when no DataSource is configured.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, JobRecord> jobs = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized JobRecord create(String type, ObjectNode payload) {
        Instant now = clock.instant();
        ObjectNode stored = payload != null ? payload.deepCopy() : JsonNodeFactory.instance.objectNode();
        JobRecord job = new JobRecord(UUID.randomUUID().toString(), type, JobStatus.PENDING, stored,
                null, null, now, now);
        jobs.put(job.id(), job);
        return job;
    }

    @Override
    public synchronized Optional<JobRecord> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized JobRecord update(JobRecord job) {
        if (!jobs.containsKey(job.id())) {
            throw new IllegalArgumentException("Unknown job " + job.id());
        }
        jobs.put(job.id(), job);
        return job;
    }

    @Override
    public synchronized List<JobRecord> recent(int limit) {
        List<JobRecord> all = new ArrayList<>(jobs.values());
        Collections.reverse(all);
        return List.copyOf(all.subList(0, Math.min(limit, all.size())));
    }
}
