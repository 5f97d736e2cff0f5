package com.adforge.core.generation;

import com.adforge.core.error.GenerationTimeoutException;
import com.adforge.core.error.TerminalProviderException;
import com.adforge.core.guard.Sleeper;
import com.adforge.core.provider.PollResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * Polls a submitted task at a fixed interval until the provider reports a terminal state or
 * the budget runs out. Interval does not grow between polls.
 */
public class TaskPoller {

    private static final Logger log = LoggerFactory.getLogger(TaskPoller.class);

    private final Sleeper sleeper;

    public TaskPoller(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public TaskPoller() {
        this(Sleeper.SYSTEM);
    }

    /**
     * @param task    the submitted task; moved to POLLING and then to its terminal state
     * @param check   one status check, typically a guarded call to the provider adapter
     * @param options interval and budget
     * @return the successful poll result, which always carries at least one result URL
     * @throws TerminalProviderException   when the provider reports failure, or success without results
     * @throws GenerationTimeoutException when the budget runs out first
     */
    public PollResult await(GenerationTask task, StatusCheck check, PollingOptions options) {
        task.transitionTo(GenerationTaskState.POLLING);
        int maxPolls = options.maxPolls();

        for (int poll = 1; poll <= maxPolls; poll++) {
            PollResult result;
            try {
                result = check.poll(task.taskId());
            } catch (RuntimeException e) {
                task.transitionTo(GenerationTaskState.FAILED);
                throw e;
            }
            task.observe(result);

            switch (result.status()) {
                case SUCCEEDED -> {
                    if (result.resultUrls().isEmpty()) {
                        task.transitionTo(GenerationTaskState.FAILED);
                        throw new TerminalProviderException(task.provider(), task.taskId(), result.rawState(),
                                "success result has no result URLs");
                    }
                    task.transitionTo(GenerationTaskState.SUCCEEDED);
                    log.info("{} task {} succeeded after {} poll(s)", task.provider(), task.taskId(), poll);
                    return result;
                }
                case FAILED -> {
                    task.transitionTo(GenerationTaskState.FAILED);
                    throw new TerminalProviderException(task.provider(), task.taskId(), result.rawState(),
                            result.errorDetail());
                }
                case IN_PROGRESS -> log.debug("{} task {} still '{}' (poll {}/{})",
                        task.provider(), task.taskId(), result.rawState(), poll, maxPolls);
            }

            if (poll < maxPolls) {
                try {
                    sleeper.sleep(options.intervalMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Polling " + task.taskId() + " interrupted");
                }
            }
        }

        task.transitionTo(GenerationTaskState.TIMED_OUT);
        throw new GenerationTimeoutException(task.provider(), task.taskId(), options.maxWaitMs());
    }

    @FunctionalInterface
    public interface StatusCheck {
        PollResult poll(String taskId);
    }
}
