package io.checkin4j.internal;

import io.checkin4j.core.SystemConfig;
import io.checkin4j.store.CheckinLogStore;
import io.checkin4j.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Daily audit-log cleanup. Keeps the newest {@code max_logs_count} rows when {@code auto_clean_logs}
 * is on. Store failures propagate to the scheduler, which logs them.
 */
public class RetentionJob implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(RetentionJob.class);

    private final ConfigStore configStore;
    private final CheckinLogStore logStore;

    public RetentionJob(ConfigStore configStore, CheckinLogStore logStore) {
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
    }

    @Override
    public void run() {
        runOnce();
    }

    /**
     * @return number of deleted rows
     */
    public long runOnce() {
        SystemConfig config = SystemConfig.load(configStore);
        if (!config.autoCleanLogs()) {
            log.debug("Log retention disabled, nothing to do");
            return 0;
        }

        long deleted = logStore.trimToMostRecent(config.maxLogsCount());
        if (deleted > 0) {
            log.info("Log retention removed rows={} maxLogsCount={}", deleted, config.maxLogsCount());
        } else {
            log.debug("Log retention found nothing to remove maxLogsCount={}", config.maxLogsCount());
        }
        return deleted;
    }
}
