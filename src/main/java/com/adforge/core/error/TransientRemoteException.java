package com.adforge.core.error;

/**
 * A failure expected to clear on its own: rate limiting, gateway errors, network resets.
 */
public class TransientRemoteException extends TaskCoreException {

    private final String provider;
    private final int status;

    public TransientRemoteException(String provider, int status, String message) {
        this(ErrorKind.TRANSIENT, provider, status, message, null);
    }

    public TransientRemoteException(String provider, String message, Throwable cause) {
        this(ErrorKind.TRANSIENT, provider, -1, message, cause);
    }

    protected TransientRemoteException(ErrorKind kind, String provider, int status,
                                       String message, Throwable cause) {
        super(kind, message, cause);
        this.provider = provider;
        this.status = status;
    }

    public String provider() {
        return provider;
    }

    /** HTTP status, or -1 when the failure happened below HTTP. */
    public int status() {
        return status;
    }
}
