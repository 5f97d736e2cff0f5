package com.adforge.core.error;

/**
 * Raised by the timeout guard when a call has not settled within its deadline.
 */
public class CallTimeoutException extends TransientRemoteException {

    private final String label;
    private final long timeoutMs;

    public CallTimeoutException(String label, long timeoutMs) {
        super(ErrorKind.TIMEOUT, label, -1, label + " timed out after " + timeoutMs + "ms", null);
        this.label = label;
        this.timeoutMs = timeoutMs;
    }

    public String label() {
        return label;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
