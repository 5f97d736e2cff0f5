package com.adforge.core.provider;

/**
 * Canonical task states every provider-specific state string is mapped onto.
 */
public enum ProviderStatus {
    SUCCEEDED,
    FAILED,
    IN_PROGRESS;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
