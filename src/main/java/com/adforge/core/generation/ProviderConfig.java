package com.adforge.core.generation;

import java.util.Objects;

/**
 * One element of a fallback chain.
 *
 * @param name             label for logs and provenance, e.g. {@code "image-to-video"}
 * @param modelId          provider model id
 * @param imageConditioned whether the request shape needs at least one reference image
 * @param requestShape     how the request body is built
 */
public record ProviderConfig(String name, String modelId, boolean imageConditioned, RequestShape requestShape) {

    public ProviderConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(requestShape, "requestShape");
    }
}
