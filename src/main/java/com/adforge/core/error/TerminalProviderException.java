package com.adforge.core.error;

/**
 * The provider explicitly reported that a submitted task failed.
 * The provider-given reason is kept verbatim when one is available.
 */
public class TerminalProviderException extends TaskCoreException {

    private final String taskId;
    private final String providerState;
    private final String reason;

    public TerminalProviderException(String provider, String taskId, String providerState, String reason) {
        super(ErrorKind.TERMINAL_PROVIDER, provider + " task " + taskId + " ended with state="
                + providerState + (reason != null && !reason.isBlank() ? ": " + reason : ""));
        this.taskId = taskId;
        this.providerState = providerState;
        this.reason = reason;
    }

    public String taskId() {
        return taskId;
    }

    public String providerState() {
        return providerState;
    }

    public String reason() {
        return reason;
    }
}
