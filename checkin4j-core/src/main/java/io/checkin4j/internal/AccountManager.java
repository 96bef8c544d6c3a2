package io.checkin4j.internal;

import io.checkin4j.ExecutionEngine;
import io.checkin4j.JobScheduler;
import io.checkin4j.core.AccountSpec;
import io.checkin4j.core.ExecutionOutcome;
import io.checkin4j.core.ReloadResult;
import io.checkin4j.core.RequestDescriptor;
import io.checkin4j.core.ScheduleTrigger;
import io.checkin4j.request.RequestSpecParser;
import io.checkin4j.store.AccountStore;
import io.checkin4j.store.CheckinLogStore;
import io.checkin4j.utils.CronSupport;
import io.checkin4j.utils.ScheduleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Entry point for account changes. Keeps the store and the {@link JobScheduler} in step:
 * an enabled account has a trigger, a disabled or deleted one does not.
 * <p>
 * Validation runs before anything is written, so a bad request spec or schedule surfaces as
 * {@link io.checkin4j.core.SpecParseException} / {@link io.checkin4j.core.ScheduleException}
 * with nothing persisted.
 */
public class AccountManager {
    private static final Logger log = LoggerFactory.getLogger(AccountManager.class);

    private final AccountStore accountStore;
    private final CheckinLogStore logStore;
    private final JobScheduler scheduler;
    private final ExecutionEngine engine;
    private final ZoneId zone;
    private final RequestSpecParser parser = new RequestSpecParser();

    public AccountManager(AccountStore accountStore,
                          CheckinLogStore logStore,
                          JobScheduler scheduler,
                          ExecutionEngine engine,
                          ZoneId zone) {
        this.accountStore = Objects.requireNonNull(accountStore, "accountStore must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public void validate(AccountSpec account) {
        Objects.requireNonNull(account, "account must not be null");
        parser.parse(account.rawSpec());
        // a disabled account is never installed, so its schedule is checked when it is enabled
        if (account.enabled()) {
            ScheduleTrigger trigger = ScheduleResolver.resolve(account.scheduleExpr());
            CronSupport.requireFires(trigger, zone, Instant.now());
        }
    }

    public AccountSpec save(AccountSpec account) {
        validate(account);

        AccountSpec saved = accountStore.save(account);
        if (saved.enabled()) {
            scheduler.install(saved.id(), saved.scheduleExpr());
        } else {
            scheduler.remove(saved.id());
        }
        log.info("Account saved id={} name={} enabled={}", saved.id(), saved.name(), saved.enabled());
        return saved;
    }

    /**
     * Remove the trigger, the account's audit rows and the account itself.
     *
     * @return false if there was no such account
     */
    public boolean delete(String accountId) {
        Objects.requireNonNull(accountId, "accountId must not be null");
        scheduler.remove(accountId);
        long logs = logStore.deleteByAccountId(accountId);
        boolean deleted = accountStore.deleteById(accountId);
        log.info("Account deleted id={} found={} logsRemoved={}", accountId, deleted, logs);
        return deleted;
    }

    public RequestDescriptor preview(String accountId) {
        return engine.preview(accountId);
    }

    /**
     * Manual run; disabled accounts run too. May overlap a scheduled run of the same account.
     */
    public ExecutionOutcome runNow(String accountId) {
        return engine.run(accountId, true);
    }

    public ReloadResult reload() {
        return scheduler.reloadAll(accountStore.findAllEnabled());
    }
}
