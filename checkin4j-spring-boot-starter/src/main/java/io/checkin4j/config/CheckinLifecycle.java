package io.checkin4j.config;

import io.checkin4j.JobScheduler;
import io.checkin4j.core.ReloadResult;
import io.checkin4j.internal.AccountManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler start/stop lifecycle with the Spring container lifecycle and installs the
 * triggers of every enabled account on startup.
 */
public class CheckinLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CheckinLifecycle.class);

    private final JobScheduler scheduler;
    private final AccountManager accountManager;
    private volatile boolean running = false;

    public CheckinLifecycle(JobScheduler scheduler, AccountManager accountManager) {
        this.scheduler = scheduler;
        this.accountManager = accountManager;
    }

    @Override
    public void start() {
        scheduler.start();
        ReloadResult result = accountManager.reload();
        if (result.hasFailures()) {
            log.warn("Accounts with unusable schedules were not installed ids={}", result.failedAccountIds());
        }
        log.info("Check-in scheduler running accounts={}", result.installed());
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
