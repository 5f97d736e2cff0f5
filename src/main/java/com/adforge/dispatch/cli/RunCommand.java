package com.adforge.dispatch.cli;

import com.adforge.core.events.EventBus;
import com.adforge.core.job.JobRecord;
import com.adforge.core.job.JobRunner;
import com.adforge.core.job.JobStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: adforge run &lt;job-id&gt;
 * <p>
 * Runs a queued job in the foreground, printing its events as they happen.
 * Exits 1 when the job ends FAILED.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a queued job")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Job ID")
    private String jobId;

    private final JobRunner jobRunner;
    private final EventBus eventBus;

    public RunCommand(JobRunner jobRunner, EventBus eventBus) {
        this.jobRunner = jobRunner;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            return execute(jobId).status() == JobStatus.COMPLETED ? 0 : 1;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }

    JobRecord execute(String id) {
        var subscription = eventBus.subscribe(id, ConsoleOutput::jobEvent);
        try {
            JobRecord finished = jobRunner.run(id);
            ConsoleOutput.job(finished);
            return finished;
        } finally {
            subscription.unsubscribe();
        }
    }
}
