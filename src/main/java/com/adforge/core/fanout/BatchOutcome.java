package com.adforge.core.fanout;

import com.adforge.core.error.ErrorSummaries;

import java.util.List;

/**
 * Result of one fan-out invocation.
 *
 * @param total          number of items submitted
 * @param processedCount items whose worker ran (succeeded or failed)
 * @param succeededCount items whose worker ran and succeeded
 * @param skippedCount   items skipped because they were already complete
 * @param failures       failed items in submission order
 */
public record BatchOutcome(
        int total,
        int processedCount,
        int succeededCount,
        int skippedCount,
        List<ItemFailure> failures
) {

    public BatchOutcome {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Single-line summary suitable for a job's result or error field. Partial success always
     * reports the {@code ok/total} counts so it reads differently from a total failure.
     */
    public String summary() {
        int ok = succeededCount + skippedCount;
        StringBuilder sb = new StringBuilder()
                .append(ok).append('/').append(total).append(" items completed");
        if (skippedCount > 0) {
            sb.append(" (").append(skippedCount).append(" already done)");
        }
        if (hasFailures()) {
            ItemFailure first = failures.get(0);
            sb.append(", ").append(failures.size()).append(" failed (first ")
                    .append(first.itemId()).append(": ").append(causeMessage(first)).append(')');
        }
        return sb.toString();
    }

    static String causeMessage(ItemFailure failure) {
        Throwable cause = failure.error().getCause();
        return cause != null ? ErrorSummaries.message(cause) : failure.message();
    }
}
