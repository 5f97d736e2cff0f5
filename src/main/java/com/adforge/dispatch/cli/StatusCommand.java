package com.adforge.dispatch.cli;

import com.adforge.core.job.JobStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: adforge status [job-id]
 * <p>
 * Shows one job, or the most recent jobs when no id is given.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check job status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Job ID")
    private String jobId;

    @Option(names = {"--limit", "-n"}, description = "Jobs to list without an id (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int limit;

    private final JobStore jobStore;

    public StatusCommand(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (jobId == null) {
            var jobs = jobStore.recent(limit);
            if (jobs.isEmpty()) {
                ConsoleOutput.info("No jobs found");
                return;
            }
            System.out.printf("  %-36s %-20s %-10s %s%n", "JOB", "TYPE", "STATUS", "UPDATED");
            System.out.println("  " + "-".repeat(90));
            for (var job : jobs) {
                System.out.printf("  %-36s %-20s %-10s %s%n", job.id(), job.type(), job.status(), job.updatedAt());
            }
            return;
        }

        jobStore.find(jobId).ifPresentOrElse(
                ConsoleOutput::job,
                () -> ConsoleOutput.error("Job not found: " + jobId));
    }
}
