package io.checkin4j.store;

import io.checkin4j.core.AuditLogEntry;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit log of execution attempts.
 *
 * <p>Rows are never updated. They leave the store only through {@link #trimToMostRecent(int)},
 * {@link #deleteExecutedBefore(Instant)} or the cascade of {@link #deleteByAccountId(String)}.
 */
public interface CheckinLogStore {

    /**
     * @return id of the new row
     */
    String append(AuditLogEntry entry);

    long count();

    /**
     * Delete the oldest rows (by execution time) so that at most {@code maxRows} remain.
     * Counting and deleting must happen in one store transaction.
     *
     * @return deleted count
     */
    long trimToMostRecent(int maxRows);

    long deleteByAccountId(String accountId);

    long deleteExecutedBefore(Instant cutoff);

    /**
     * Newest rows first.
     */
    List<AuditLogEntry> findRecent(int limit);
}
