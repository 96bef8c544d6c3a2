package io.checkin4j.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Static runtime configuration. Notification channels and log retention are read from the
 * config store instead, so they can change without a restart.
 */
@ConfigurationProperties(prefix = "checkin")
public class CheckinProperties {
    private boolean enabled = true;
    private String timezone; // null = system default
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration notificationTimeout = Duration.ofSeconds(10);
    private String retentionCron = "0 3 * * *";
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getNotificationTimeout() {
        return notificationTimeout;
    }

    public void setNotificationTimeout(Duration notificationTimeout) {
        this.notificationTimeout = notificationTimeout;
    }

    public String getRetentionCron() {
        return retentionCron;
    }

    public void setRetentionCron(String retentionCron) {
        this.retentionCron = retentionCron;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    /**
     * Zone used to evaluate every cron expression.
     */
    public ZoneId zoneId() {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone.trim());
    }
}
