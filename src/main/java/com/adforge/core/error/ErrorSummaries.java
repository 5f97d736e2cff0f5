package com.adforge.core.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for turning exceptions into the single-line messages stored on job and item records.
 */
public final class ErrorSummaries {

    private static final int MAX_LENGTH = 500;

    private ErrorSummaries() {}

    /**
     * Unwraps executor wrappers so classification sees the exception the work actually threw.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Single-line, length-capped message for an exception; falls back to the class name.
     */
    public static String message(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        String flat = message.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
        return flat.length() <= MAX_LENGTH ? flat : flat.substring(0, MAX_LENGTH - 3) + "...";
    }
}
