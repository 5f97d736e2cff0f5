package com.adforge.core.generation;

import com.adforge.core.provider.PollResult;

/**
 * Tracks one submitted task through {@code SUBMITTED -> POLLING -> SUCCEEDED | FAILED | TIMED_OUT}.
 */
public class GenerationTask {

    private final String provider;
    private final String taskId;
    private GenerationTaskState state = GenerationTaskState.SUBMITTED;
    private PollResult lastResult;
    private int polls;

    public GenerationTask(String provider, String taskId) {
        this.provider = provider;
        this.taskId = taskId;
    }

    void transitionTo(GenerationTaskState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Generation task " + taskId + ": " + state + " -> " + next + " not allowed");
        }
        state = next;
    }

    void observe(PollResult result) {
        lastResult = result;
        polls++;
    }

    public String provider() {
        return provider;
    }

    public String taskId() {
        return taskId;
    }

    public GenerationTaskState state() {
        return state;
    }

    public PollResult lastResult() {
        return lastResult;
    }

    public int polls() {
        return polls;
    }
}
