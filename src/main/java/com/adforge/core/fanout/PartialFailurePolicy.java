package com.adforge.core.fanout;

/**
 * What a fan-out does once every item has settled and at least one failed.
 */
public enum PartialFailurePolicy {
    /** Raise {@link BatchFailedException} carrying the full outcome. */
    AGGREGATE_AND_THROW,
    /** Return the outcome; the caller reports the counts. */
    BEST_EFFORT
}
