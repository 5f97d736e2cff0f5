package com.adforge.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code adforge} command line once the context is up and hands the command's exit
 * code (0 completed, 1 job failed, 2 usage error) back to Spring Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final AdforgeCommand adforgeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AdforgeCommand adforgeCommand, IFactory factory) {
        this.adforgeCommand = adforgeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(adforgeCommand, factory).execute(args);
        log.debug("adforge {} exited with {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
