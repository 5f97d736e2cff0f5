package com.adforge.core.generation;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds one provider's request body for a generation request.
 */
@FunctionalInterface
public interface RequestShape {

    ObjectNode build(GenerationRequest request, String modelId);
}
