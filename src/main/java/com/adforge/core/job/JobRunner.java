package com.adforge.core.job;

import com.adforge.core.error.ConfigException;
import com.adforge.core.error.ErrorKind;
import com.adforge.core.error.ErrorSummaries;
import com.adforge.core.error.TaskCoreException;
import com.adforge.core.events.JobEvent;
import com.adforge.core.events.JobEventPublisher;
import com.adforge.core.logging.MdcContext;
import com.adforge.core.metrics.TaskCoreMetrics;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs queued jobs through the handler registered for their type.
 * <p>
 * This is the outermost catch: whatever a handler throws ends up as the job's single-line
 * {@code error}, and the job is left COMPLETED or FAILED, never RUNNING.
 */
@Service
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    static final String CONFIG_TAG = "[config] ";

    private final JobStore store;
    private final Map<String, JobHandler> handlers;
    private final JobEventPublisher events;
    private final TaskCoreMetrics metrics;
    private final Clock clock;

    public JobRunner(JobStore store, List<JobHandler> handlers, List<JobHandlerSource> sources,
                     JobEventPublisher events, TaskCoreMetrics metrics, Clock clock) {
        this.store = store;
        this.handlers = Stream.concat(handlers.stream(), sources.stream().flatMap(s -> s.handlers().stream()))
                .collect(Collectors.toMap(JobHandler::type, Function.identity(), (a, b) -> {
                    throw new IllegalStateException("Duplicate handler for job type " + a.type());
                }, LinkedHashMap::new));
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Set<String> jobTypes() {
        return handlers.keySet();
    }

    /**
     * Queues a job.
     *
     * @throws ConfigException when no handler serves {@code type}
     */
    public JobRecord submit(String type, ObjectNode payload) {
        if (!handlers.containsKey(type)) {
            throw new ConfigException("No handler for job type '" + type + "' (known: "
                    + String.join(", ", handlers.keySet()) + ")");
        }
        JobRecord job = store.create(type, payload);
        log.info("Queued job {} of type {}", job.id(), type);
        return job;
    }

    /**
     * Runs a PENDING job, or resumes one left RUNNING by an interrupted process.
     * Terminal jobs are returned unchanged.
     *
     * @throws IllegalArgumentException when the job does not exist
     */
    public JobRecord run(String jobId) {
        JobRecord job = store.find(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job " + jobId));
        if (job.status().isTerminal()) {
            log.info("Job {} is already {}", jobId, job.status());
            return job;
        }

        MdcContext.setJob(job.id(), job.type());
        long started = System.currentTimeMillis();
        try {
            if (job.status() == JobStatus.PENDING) {
                job = store.update(job.transitionTo(JobStatus.RUNNING, clock.instant()));
            } else {
                log.info("Resuming job {} left RUNNING", jobId);
            }
            events.publish(JobEvent.JOB_STARTED, job.id(), null, Map.of("type", job.type()));
            log.info("Running job {} ({})", job.id(), job.type());

            JobRecord finished;
            try {
                JobResult result = handlerFor(job.type()).handle(job);
                finished = store.update(job.completed(result.summary(), clock.instant()));
                events.publish(JobEvent.JOB_COMPLETED, job.id(), null, Map.of("summary", result.summary()));
                log.info("Job {} completed: {}", job.id(), result.summary());
            } catch (Exception e) {
                String error = failureSummary(e);
                finished = store.update(job.failed(error, clock.instant()));
                events.publish(JobEvent.JOB_FAILED, job.id(), null, Map.of("error", error));
                log.error("Job {} failed: {}", job.id(), error, e);
            }
            metrics.recordJobResult(job.type(), finished.status().name().toLowerCase(Locale.ROOT),
                    System.currentTimeMillis() - started);
            return finished;
        } finally {
            MdcContext.clear();
        }
    }

    private JobHandler handlerFor(String type) {
        JobHandler handler = handlers.get(type);
        if (handler == null) {
            throw new ConfigException("No handler for job type '" + type + "'");
        }
        return handler;
    }

    /**
     * Single-line error stored on a failed job. Configuration problems are tagged so an operator
     * can tell them from provider outages.
     */
    static String failureSummary(Throwable error) {
        Throwable cause = ErrorSummaries.unwrap(error);
        String message = ErrorSummaries.message(cause);
        if (cause instanceof TaskCoreException core && core.kind() == ErrorKind.CONFIG) {
            return CONFIG_TAG + message;
        }
        return message;
    }
}
