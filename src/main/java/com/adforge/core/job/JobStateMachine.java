package com.adforge.core.job;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal job status transitions: {@code PENDING -> RUNNING} and {@code RUNNING -> COMPLETED | FAILED}.
 * A pending job cannot fail without having run.
 */
public final class JobStateMachine {

    private static final Map<JobStatus, Set<JobStatus>> ALLOWED = Map.of(
            JobStatus.PENDING, EnumSet.of(JobStatus.RUNNING),
            JobStatus.RUNNING, EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED),
            JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class),
            JobStatus.FAILED, EnumSet.noneOf(JobStatus.class));

    private JobStateMachine() {}

    public static boolean canTransition(JobStatus from, JobStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    public static void assertTransition(String jobId, JobStatus from, JobStatus to) {
        if (!canTransition(from, to)) {
            throw new IllegalJobTransitionException(jobId, from, to);
        }
    }
}
