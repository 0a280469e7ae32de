package com.marketfeed.marketdata.snapshot;

import java.time.Instant;

/**
 * Outcome of the most recent snapshot writes. Appends never report persistence errors
 * themselves; this is where they become observable.
 *
 * @param lastError message of the latest failure, {@code null} when none occurred yet
 */
public record PersistenceStatus(
    Instant lastSuccessAt,
    Instant lastFailureAt,
    String lastError
) {
    public static PersistenceStatus initial() {
        return new PersistenceStatus(null, null, null);
    }

    /** {@code true} unless the latest write attempt failed. */
    public boolean healthy() {
        return lastFailureAt == null || (lastSuccessAt != null && lastSuccessAt.isAfter(lastFailureAt));
    }
}
