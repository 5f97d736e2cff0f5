package com.adforge.core.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One status observation of a submitted task.
 *
 * @param taskId      provider task id
 * @param rawState    state string exactly as the provider reported it, may be blank
 * @param status      normalized state
 * @param resultUrls  result URLs in priority order, empty unless succeeded
 * @param errorDetail provider-given failure detail, may be null
 * @param raw         the full provider response, kept for provenance
 */
public record PollResult(
        String taskId,
        String rawState,
        ProviderStatus status,
        List<String> resultUrls,
        String errorDetail,
        JsonNode raw
) {

    public PollResult {
        resultUrls = resultUrls != null ? List.copyOf(resultUrls) : List.of();
    }
}
