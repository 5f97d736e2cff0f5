package com.adforge.core.provider;

import com.adforge.core.guard.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The three verbs the core needs from a remote provider. Implementations classify their
 * failures into the error taxonomy and abort in-flight requests when the token is cancelled.
 * Calls are unguarded; callers wrap each one in a guarded call.
 */
public interface RemoteProviderAdapter {

    String name();

    /**
     * @return the provider's task id
     */
    String submit(JsonNode input, CancellationToken token) throws Exception;

    PollResult poll(String taskId, CancellationToken token) throws Exception;

    List<RemoteItem> fetchBatch(String datasetId, CancellationToken token) throws Exception;
}
