package com.adforge.core.fanout;

import com.adforge.core.error.ErrorKind;
import com.adforge.core.error.TaskCoreException;

/**
 * Raised after a fan-out settles with at least one failed item under
 * {@link PartialFailurePolicy#AGGREGATE_AND_THROW}. Sibling items have already been persisted.
 */
public class BatchFailedException extends TaskCoreException {

    private final BatchOutcome outcome;

    public BatchFailedException(String label, BatchOutcome outcome) {
        super(ErrorKind.BATCH, label + " failed for " + outcome.failures().size() + "/" + outcome.total()
                + " items (first " + outcome.failures().get(0).itemId() + ": "
                + BatchOutcome.causeMessage(outcome.failures().get(0)) + ")");
        this.outcome = outcome;
    }

    public BatchOutcome outcome() {
        return outcome;
    }
}
