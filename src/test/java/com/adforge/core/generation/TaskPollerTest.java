package com.adforge.core.generation;

import com.adforge.core.error.GenerationTimeoutException;
import com.adforge.core.error.TerminalProviderException;
import com.adforge.core.error.TransientRemoteException;
import com.adforge.core.provider.PollResult;
import com.adforge.core.provider.ProviderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskPollerTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final TaskPoller poller = new TaskPoller(sleeps::add);

    private static PollResult result(String state, ProviderStatus status, List<String> urls, String error) {
        return new PollResult("task-1", state, status, urls, error, null);
    }

    private static TaskPoller.StatusCheck sequence(PollResult... results) {
        Iterator<PollResult> it = List.of(results).iterator();
        return taskId -> it.next();
    }

    @Test
    @DisplayName("polls until success and sleeps between polls")
    void pollsUntilSuccess() {
        var task = new GenerationTask("kie", "task-1");

        PollResult done = poller.await(task, sequence(
                result("waiting", ProviderStatus.IN_PROGRESS, List.of(), null),
                result("generating", ProviderStatus.IN_PROGRESS, List.of(), null),
                result("success", ProviderStatus.SUCCEEDED, List.of("https://cdn/clip.mp4"), null)),
                new PollingOptions(30_000, 720_000));

        assertEquals("https://cdn/clip.mp4", done.resultUrls().get(0));
        assertEquals(GenerationTaskState.SUCCEEDED, task.state());
        assertEquals(3, task.polls());
        assertEquals(List.of(30_000L, 30_000L), sleeps);
    }

    @Test
    @DisplayName("a provider failure is terminal and carries the provider's detail")
    void terminalFailure() {
        var task = new GenerationTask("kie", "task-1");

        var error = assertThrows(TerminalProviderException.class, () -> poller.await(task,
                sequence(result("fail", ProviderStatus.FAILED, List.of(), "code=501 content policy")),
                new PollingOptions(10, 100)));

        assertTrue(error.getMessage().contains("content policy"));
        assertEquals(GenerationTaskState.FAILED, task.state());
    }

    @Test
    @DisplayName("success without result URLs is a terminal failure")
    void successWithoutUrls() {
        var task = new GenerationTask("kie", "task-1");

        assertThrows(TerminalProviderException.class, () -> poller.await(task,
                sequence(result("success", ProviderStatus.SUCCEEDED, List.of(), null)),
                new PollingOptions(10, 100)));
        assertEquals(GenerationTaskState.FAILED, task.state());
    }

    @Test
    @DisplayName("the budget allows maxWait / interval polls and does not sleep after the last")
    void timesOut() {
        var task = new GenerationTask("kie", "task-1");
        TaskPoller.StatusCheck pending = taskId -> result("queued", ProviderStatus.IN_PROGRESS, List.of(), null);

        assertThrows(GenerationTimeoutException.class,
                () -> poller.await(task, pending, new PollingOptions(30_000, 120_000)));

        assertEquals(4, task.polls());
        assertEquals(3, sleeps.size());
        assertEquals(GenerationTaskState.TIMED_OUT, task.state());
    }

    @Test
    @DisplayName("a failing status check fails the task and propagates")
    void checkFailure() {
        var task = new GenerationTask("kie", "task-1");

        assertThrows(TransientRemoteException.class, () -> poller.await(task,
                taskId -> { throw new TransientRemoteException("kie", 503, "down"); },
                new PollingOptions(10, 100)));
        assertEquals(GenerationTaskState.FAILED, task.state());
    }
}
