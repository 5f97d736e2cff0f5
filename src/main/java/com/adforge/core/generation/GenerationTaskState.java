package com.adforge.core.generation;

/**
 * Lifecycle of one submitted generation task.
 */
public enum GenerationTaskState {
    SUBMITTED,
    POLLING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }

    public boolean canTransitionTo(GenerationTaskState next) {
        return switch (this) {
            case SUBMITTED -> next == POLLING;
            case POLLING -> next.isTerminal();
            case SUCCEEDED, FAILED, TIMED_OUT -> false;
        };
    }
}
