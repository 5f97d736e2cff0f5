package com.adforge.core.store;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Durable "already done" test evaluated against an item's persisted state.
 *
 * @param kind  how the marker is detected
 * @param field payload field holding the marker; ignored for {@link Kind#OUTCOME_RECORDED}
 */
public record CompletionMarker(Kind kind, String field) {

    public enum Kind {
        /** Payload field is a non-blank string, e.g. a transcript. */
        NON_BLANK_TEXT,
        /** Payload field is a JSON object, e.g. a quality-gate verdict. */
        OBJECT,
        /** A successful outcome has been saved for the item. */
        OUTCOME_RECORDED
    }

    public CompletionMarker {
        if (kind != Kind.OUTCOME_RECORDED && (field == null || field.isBlank())) {
            throw new IllegalArgumentException(kind + " completion marker needs a field");
        }
    }

    public static CompletionMarker nonBlankText(String field) {
        return new CompletionMarker(Kind.NON_BLANK_TEXT, field);
    }

    public static CompletionMarker object(String field) {
        return new CompletionMarker(Kind.OBJECT, field);
    }

    public static CompletionMarker outcomeRecorded() {
        return new CompletionMarker(Kind.OUTCOME_RECORDED, null);
    }

    public boolean isPresent(ItemRecord record) {
        if (record == null) {
            return false;
        }
        return switch (kind) {
            case OUTCOME_RECORDED -> record.completedAt() != null;
            case NON_BLANK_TEXT -> {
                JsonNode value = record.payload() != null ? record.payload().get(field) : null;
                yield value != null && value.isTextual() && !value.asText().isBlank();
            }
            case OBJECT -> {
                JsonNode value = record.payload() != null ? record.payload().get(field) : null;
                yield value != null && value.isObject();
            }
        };
    }
}
