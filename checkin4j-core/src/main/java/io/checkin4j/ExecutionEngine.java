package io.checkin4j;

import io.checkin4j.core.ExecutionOutcome;
import io.checkin4j.core.RequestDescriptor;

/**
 * Runs one account's check-in: parse, send with retries, audit, notify.
 */
public interface ExecutionEngine {

    /**
     * Never throws for missing accounts, bad request specs or HTTP failures; those end up in the
     * outcome. Store failures propagate as {@link io.checkin4j.core.PersistenceException}.
     *
     * @param skipEnabledCheck true for manual runs, which also run disabled accounts
     */
    ExecutionOutcome run(String accountId, boolean skipEnabledCheck);

    /**
     * Dry run: the request the next execution would send, without sending it.
     *
     * @throws io.checkin4j.core.SpecParseException when the stored request spec is invalid
     * @throws IllegalArgumentException when the account does not exist
     */
    RequestDescriptor preview(String accountId);
}
