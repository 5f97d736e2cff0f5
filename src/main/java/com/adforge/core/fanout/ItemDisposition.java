package com.adforge.core.fanout;

/**
 * How a work item settled without failing.
 */
public enum ItemDisposition {
    SUCCEEDED,
    /** Already carried a completion marker; the worker was not invoked. */
    SKIPPED
}
