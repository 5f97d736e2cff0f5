package com.adforge.dispatch.cli;

import com.adforge.core.guard.BreakerRegistry;
import com.adforge.core.guard.BreakerState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.time.Instant;

/**
 * CLI command: adforge breakers
 * <p>
 * Lists the circuit breakers this process has seen. Breaker state is per process, so this is
 * mostly useful after {@code submit --run} in the same invocation or from tests.
 */
@Command(name = "breakers", mixinStandardHelpOptions = true, description = "Show circuit breaker state")
@Component
public class BreakersCommand implements Runnable {

    private final BreakerRegistry breakers;

    public BreakersCommand(BreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var states = breakers.snapshot();
        if (states.isEmpty()) {
            ConsoleOutput.info("No circuit breakers recorded");
            return;
        }
        Instant now = breakers.now();
        System.out.printf("  %-32s %-10s %-9s %s%n", "KEY", "STATE", "FAILURES", "OPEN UNTIL");
        System.out.println("  " + "-".repeat(72));
        for (BreakerState state : states) {
            System.out.printf("  %-32s %-10s %-9d %s%n", state.key(), state.phaseAt(now),
                    state.consecutiveFailures(), state.openedUntil() != null ? state.openedUntil() : "-");
        }
    }
}
