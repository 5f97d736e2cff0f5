package com.adforge.core.error;

/**
 * Base type for every failure raised by the task execution core.
 */
public class TaskCoreException extends RuntimeException {

    private final ErrorKind kind;

    public TaskCoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TaskCoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
