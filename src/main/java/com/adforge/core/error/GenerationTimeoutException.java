package com.adforge.core.error;

/**
 * A submitted generation task did not reach a terminal state within its polling budget.
 */
public class GenerationTimeoutException extends TaskCoreException {

    private final String taskId;

    public GenerationTimeoutException(String provider, String taskId, long budgetMs) {
        super(ErrorKind.TIMEOUT, provider + " task " + taskId + " did not complete within " + budgetMs + "ms");
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
