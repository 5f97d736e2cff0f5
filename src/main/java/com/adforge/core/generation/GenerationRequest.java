package com.adforge.core.generation;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * The semantic content of one generation task, independent of any provider's request shape.
 *
 * @param prompt             generation prompt
 * @param referenceImageUrls visual references in composition priority order, may be empty
 * @param parameters         provider-neutral parameters such as duration or aspect ratio
 */
public record GenerationRequest(String prompt, List<String> referenceImageUrls, ObjectNode parameters) {

    public GenerationRequest {
        referenceImageUrls = referenceImageUrls != null ? List.copyOf(referenceImageUrls) : List.of();
        parameters = parameters != null ? parameters : JsonNodeFactory.instance.objectNode();
    }

    public boolean hasReferenceImages() {
        return !referenceImageUrls.isEmpty();
    }
}
