package io.checkin4j.notify;

/**
 * One delivery mechanism (generic webhook, Telegram, ...).
 * Channels are stateless; every call receives the configuration as it is right now.
 */
public interface NotificationChannel {

    /**
     * Unique identifier for this channel (e.g. "webhook", "telegram").
     */
    String channelId();

    /**
     * Whether the administrator switched this channel on.
     */
    boolean isEnabled(NotificationConfig config);

    /**
     * Whether the settings needed to send at all are present.
     */
    boolean isConfigured(NotificationConfig config);

    /**
     * Sends the event.
     *
     * @throws io.checkin4j.core.NotificationException when the target cannot be reached or answers non-2xx
     */
    void deliver(NotificationEvent event, NotificationConfig config);
}
