package com.adforge.dispatch.cli;

import com.adforge.core.job.JobRecord;
import com.adforge.core.job.JobRunner;
import com.adforge.core.job.JobStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: adforge submit &lt;type&gt; --payload '{...}' [--run]
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Queue a job, optionally running it")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Job type (a configured pipeline or scene-videos)")
    private String type;

    @Option(names = {"--payload", "-p"}, description = "Job payload as a JSON object", defaultValue = "{}")
    private String payload;

    @Option(names = {"--run", "-r"}, description = "Run the job immediately")
    private boolean runNow;

    private final JobRunner jobRunner;
    private final ObjectMapper objectMapper;
    private final RunCommand runCommand;

    public SubmitCommand(JobRunner jobRunner, ObjectMapper objectMapper, RunCommand runCommand) {
        this.jobRunner = jobRunner;
        this.objectMapper = objectMapper;
        this.runCommand = runCommand;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(payload);
        } catch (Exception e) {
            ConsoleOutput.error("Payload is not valid JSON: " + e.getMessage());
            return 2;
        }
        if (!(parsed instanceof ObjectNode object)) {
            ConsoleOutput.error("Payload must be a JSON object");
            return 2;
        }

        JobRecord job;
        try {
            job = jobRunner.submit(type, object);
        } catch (RuntimeException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.success("Queued job " + job.id() + " (" + job.type() + ")");
        if (!runNow) {
            ConsoleOutput.info("Run it with: adforge run " + job.id());
            return 0;
        }
        return runCommand.execute(job.id()).status() == JobStatus.COMPLETED ? 0 : 1;
    }
}
