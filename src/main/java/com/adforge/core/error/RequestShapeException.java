package com.adforge.core.error;

/**
 * The provider rejected the payload itself (malformed or unsupported fields, HTTP 400/422).
 * Retrying the same configuration cannot succeed; a fallback chain may try the next one.
 */
public class RequestShapeException extends TaskCoreException {

    private final String provider;
    private final int status;
    private final String detail;

    public RequestShapeException(String provider, int status, String detail) {
        super(ErrorKind.REQUEST_SHAPE, provider + " rejected request"
                + (status > 0 ? " (" + status + ")" : "")
                + (detail != null && !detail.isBlank() ? ": " + detail : ""));
        this.provider = provider;
        this.status = status;
        this.detail = detail;
    }

    public String provider() {
        return provider;
    }

    public int status() {
        return status;
    }

    public String detail() {
        return detail;
    }
}
