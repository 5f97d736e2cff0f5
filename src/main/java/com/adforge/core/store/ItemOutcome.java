package com.adforge.core.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Result of processing one item, saved as soon as it is known.
 * A success merges {@code patch} into the stored payload; a failure records {@code error} only.
 */
public record ItemOutcome(Status status, ObjectNode patch, String error) {

    public enum Status { SUCCEEDED, FAILED }

    public static ItemOutcome succeeded(ObjectNode patch) {
        return new ItemOutcome(Status.SUCCEEDED, Objects.requireNonNull(patch, "patch"), null);
    }

    public static ItemOutcome failed(String error) {
        return new ItemOutcome(Status.FAILED, null, error);
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
