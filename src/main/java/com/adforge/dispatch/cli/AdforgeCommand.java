package com.adforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Adforge.
 * Routes to subcommands: submit, run, status, health, breakers.
 */
@Command(
        name = "adforge",
        mixinStandardHelpOptions = true,
        version = "Adforge 0.1.0",
        description = "Resilient job runner for ad research and creative generation pipelines",
        subcommands = {
                SubmitCommand.class,
                RunCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                BreakersCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AdforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
