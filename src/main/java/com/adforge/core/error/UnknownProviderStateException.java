package com.adforge.core.error;

/**
 * A provider reported a state string that its state table does not map.
 * Treated as a configuration error so that the mapping gets fixed instead of polling forever.
 */
public class UnknownProviderStateException extends ConfigException {

    private final String provider;
    private final String state;

    public UnknownProviderStateException(String provider, String state) {
        super("Unmapped " + provider + " task state '" + state + "'");
        this.provider = provider;
        this.state = state;
    }

    public String provider() {
        return provider;
    }

    public String state() {
        return state;
    }
}
