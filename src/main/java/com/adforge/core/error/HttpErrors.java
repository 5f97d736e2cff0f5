package com.adforge.core.error;

/**
 * Maps HTTP failure statuses onto the error taxonomy.
 */
public final class HttpErrors {

    private HttpErrors() {}

    public static boolean isTransientStatus(int status) {
        return status == 408 || status == 425 || status == 429 || status >= 500;
    }

    /**
     * @param provider name used in messages
     * @param status   non-2xx HTTP status
     * @param detail   provider-given error detail, may be null
     */
    public static TaskCoreException fromStatus(String provider, int status, String detail) {
        if (status == 401 || status == 403) {
            return new ConfigException(provider + " rejected credentials (" + status + ")"
                    + (detail != null && !detail.isBlank() ? ": " + detail : ""));
        }
        if (isTransientStatus(status)) {
            return new TransientRemoteException(provider, status, provider + " request failed ("
                    + status + ")" + (detail != null && !detail.isBlank() ? ": " + detail : ""));
        }
        return new RequestShapeException(provider, status, detail);
    }
}
