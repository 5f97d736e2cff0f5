package com.adforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing task-core MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String JOB_ID = "jobId";
    public static final String JOB_TYPE = "jobType";
    public static final String ITEM_ID = "itemId";
    public static final String BREAKER_KEY = "breakerKey";

    private MdcContext() {}

    public static void setJob(String jobId, String jobType) {
        MDC.put(JOB_ID, jobId);
        if (jobType != null) {
            MDC.put(JOB_TYPE, jobType);
        }
    }

    public static void setItem(String jobId, String itemId) {
        if (jobId != null) {
            MDC.put(JOB_ID, jobId);
        }
        MDC.put(ITEM_ID, itemId);
    }

    public static void setBreakerKey(String breakerKey) {
        MDC.put(BREAKER_KEY, breakerKey);
    }

    public static String currentJobId() {
        return MDC.get(JOB_ID);
    }

    public static void clearItem() {
        MDC.remove(ITEM_ID);
    }

    public static void clearBreakerKey() {
        MDC.remove(BREAKER_KEY);
    }

    public static void clear() {
        MDC.remove(JOB_ID);
        MDC.remove(JOB_TYPE);
        MDC.remove(ITEM_ID);
        MDC.remove(BREAKER_KEY);
    }
}
