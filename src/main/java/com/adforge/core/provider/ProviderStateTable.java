package com.adforge.core.provider;

import com.adforge.core.error.UnknownProviderStateException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Explicit mapping from one provider's state strings to {@link ProviderStatus}.
 * <p>
 * Lookup is exact after trimming and lower-casing. A blank state means the provider has not
 * assigned one yet and reads as in progress. Any other unmapped string raises
 * {@link UnknownProviderStateException} instead of being guessed at.
 */
public final class ProviderStateTable {

    private final String provider;
    private final Map<String, ProviderStatus> states;

    private ProviderStateTable(String provider, Map<String, ProviderStatus> states) {
        this.provider = provider;
        this.states = Collections.unmodifiableMap(states);
    }

    public static Builder builder(String provider) {
        return new Builder(provider);
    }

    /**
     * States the Kie.ai jobs API reports.
     */
    public static ProviderStateTable kie() {
        return builder("kie")
                .map(ProviderStatus.SUCCEEDED, "success", "succeeded", "completed")
                .map(ProviderStatus.IN_PROGRESS, "ing", "running", "waiting", "queued", "queuing", "pending", "processing",
                        "generating")
                .map(ProviderStatus.FAILED, "fail", "failed", "error", "cancelled", "canceled")
                .build();
    }

    public ProviderStatus normalize(String rawState) {
        if (rawState == null || rawState.isBlank()) {
            return ProviderStatus.IN_PROGRESS;
        }
        ProviderStatus status = states.get(key(rawState));
        if (status == null) {
            throw new UnknownProviderStateException(provider, rawState);
        }
        return status;
    }

    public String provider() {
        return provider;
    }

    public Map<String, ProviderStatus> mappings() {
        return states;
    }

    /**
     * Copy of this table with extra mappings layered on top, e.g. from configuration.
     */
    public ProviderStateTable with(Map<String, ProviderStatus> extra) {
        Builder builder = new Builder(provider);
        builder.states.putAll(states);
        extra.forEach((state, status) -> builder.map(status, state));
        return builder.build();
    }

    private static String key(String state) {
        return state.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final String provider;
        private final Map<String, ProviderStatus> states = new LinkedHashMap<>();

        private Builder(String provider) {
            this.provider = provider;
        }

        public Builder map(ProviderStatus status, String... rawStates) {
            for (String raw : rawStates) {
                states.put(key(raw), status);
            }
            return this;
        }

        public ProviderStateTable build() {
            return new ProviderStateTable(provider, new LinkedHashMap<>(states));
        }
    }
}
