package io.checkin4j.core;

import java.util.List;

/**
 * Result of reloading every account trigger.
 *
 * installed        : number of account triggers installed
 * failedAccountIds : accounts whose schedule could not be installed
 */
public record ReloadResult(int installed, List<String> failedAccountIds) {

    public ReloadResult {
        failedAccountIds = List.copyOf(failedAccountIds);
    }

    public boolean hasFailures() {
        return !failedAccountIds.isEmpty();
    }
}
