package io.checkin4j.core;

import io.checkin4j.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retention settings, loaded from the {@link ConfigStore} each time they are needed.
 */
public record SystemConfig(boolean autoCleanLogs, int maxLogsCount) {

    private static final Logger log = LoggerFactory.getLogger(SystemConfig.class);

    public static final String KEY_AUTO_CLEAN_LOGS = "auto_clean_logs";
    public static final String KEY_MAX_LOGS_COUNT = "max_logs_count";
    public static final int DEFAULT_MAX_LOGS_COUNT = 500;

    public static SystemConfig load(ConfigStore store) {
        boolean autoClean = store.isTrue(KEY_AUTO_CLEAN_LOGS);
        int maxLogs = store.get(KEY_MAX_LOGS_COUNT)
                .map(SystemConfig::parseMaxLogs)
                .orElse(DEFAULT_MAX_LOGS_COUNT);
        return new SystemConfig(autoClean, maxLogs);
    }

    private static int parseMaxLogs(String raw) {
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            value = -1;
        }
        if (value >= 0) {
            return value;
        }
        log.warn("Invalid {}={}, using default {}", KEY_MAX_LOGS_COUNT, raw, DEFAULT_MAX_LOGS_COUNT);
        return DEFAULT_MAX_LOGS_COUNT;
    }
}
