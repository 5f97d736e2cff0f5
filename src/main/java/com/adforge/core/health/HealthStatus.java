package com.adforge.core.health;

import java.util.Map;

/**
 * One line of {@code adforge health}.
 *
 * @param component breakers, provider, item-store, job-store or database
 * @param detail    human-readable reason, printed next to the component
 * @param metadata  extra facts for the component; for breakers, each open key mapped to its
 *                  openedUntil instant
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    /** A degraded component does not count as up. */
    public boolean isUp() {
        return status == Status.UP;
    }
}
