package com.adforge.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Readers for job payload fields.
 */
final class JobPayloads {

    private JobPayloads() {}

    static String requireText(ObjectNode payload, String field, String jobId) {
        String value = text(payload, field);
        if (value == null) {
            throw new IllegalArgumentException("Job " + jobId + " payload needs '" + field + "'");
        }
        return value;
    }

    static String text(ObjectNode payload, String field) {
        JsonNode node = payload != null ? payload.get(field) : null;
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    static boolean flag(ObjectNode payload, String field) {
        JsonNode node = payload != null ? payload.get(field) : null;
        return node != null && (node.isBoolean() ? node.booleanValue() : "true".equalsIgnoreCase(node.asText()));
    }
}
