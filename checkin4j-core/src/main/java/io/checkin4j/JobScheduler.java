package io.checkin4j;

import io.checkin4j.core.AccountSpec;
import io.checkin4j.core.ReloadResult;
import io.checkin4j.core.ScheduleTrigger;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Binds accounts to live cron triggers.
 *
 * <p>At most one trigger exists per account id. Besides the account triggers the scheduler owns a
 * daily retention trigger, installed by {@link #start()} and untouched by {@link #reloadAll(Collection)}.
 */
public interface JobScheduler {
    void start();

    void stop();

    /**
     * Resolve {@code scheduleExpr} and replace any trigger of this account with the result.
     * If resolution fails the existing trigger, if any, is kept.
     *
     * @throws io.checkin4j.core.ScheduleException when the expression cannot be scheduled
     */
    void install(String accountId, String scheduleExpr);

    /**
     * Idempotent. An execution already in flight is not interrupted.
     */
    void remove(String accountId);

    /**
     * Drop every account trigger, then install each enabled account. A bad schedule is logged and
     * reported, it does not stop the others from loading.
     */
    ReloadResult reloadAll(Collection<AccountSpec> accounts);

    boolean isInstalled(String accountId);

    Set<String> installedAccountIds();

    Optional<ScheduleTrigger> triggerFor(String accountId);

    Optional<Instant> nextFireTime(String accountId);
}
