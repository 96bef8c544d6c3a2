package io.checkin4j.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.checkin4j.core.ExecutionStatus;
import io.checkin4j.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fans an outcome out to every enabled channel.
 * <p>
 * Delivery is best-effort: each channel is tried on its own and a failure is logged and reported
 * in the returned {@link ChannelResult}, never thrown. Configuration is reloaded on every call.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final NotificationEvent TEST_EVENT = new NotificationEvent(
            "Test Account",
            ExecutionStatus.SUCCESS,
            200,
            "This is a test notification",
            "{\"test\": true}");

    private final Map<String, NotificationChannel> channels;
    private final ConfigStore configStore;
    private final ObjectMapper objectMapper;

    public NotificationDispatcher(List<NotificationChannel> channels, ConfigStore configStore, ObjectMapper objectMapper) {
        Objects.requireNonNull(channels, "channels must not be null");
        this.channels = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.channelId(), channel);
        }
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * The five built-in channels sharing one client.
     */
    public static List<NotificationChannel> defaultChannels(RestClient restClient, Clock clock) {
        return List.of(
                new WebhookChannel(restClient, clock),
                new TelegramChannel(restClient, clock),
                new DingTalkChannel(restClient, clock),
                new WeComChannel(restClient, clock),
                new FeishuChannel(restClient, clock));
    }

    public List<ChannelResult> fanout(String accountName, ExecutionStatus status, Integer responseCode,
                                      String message, String responseBody) {
        return fanout(new NotificationEvent(accountName, status, responseCode, message, responseBody));
    }

    public List<ChannelResult> fanout(NotificationEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        NotificationConfig config = NotificationConfig.load(configStore, objectMapper);

        List<ChannelResult> results = new ArrayList<>(channels.size());
        for (NotificationChannel channel : channels.values()) {
            if (!channel.isEnabled(config)) {
                results.add(ChannelResult.skipped(channel.channelId(), "disabled"));
                continue;
            }
            results.add(send(channel, event, config));
        }
        return results;
    }

    /**
     * Sends a sample notification through one channel, whether or not it is enabled.
     *
     * @throws IllegalArgumentException if no channel has this id
     */
    public ChannelResult sendTest(String channelId) {
        NotificationChannel channel = channels.get(channelId);
        if (channel == null) {
            throw new IllegalArgumentException("Unknown notification channel: " + channelId);
        }
        NotificationConfig config = NotificationConfig.load(configStore, objectMapper);
        return send(channel, TEST_EVENT, config);
    }

    public Set<String> channelIds() {
        return Collections.unmodifiableSet(channels.keySet());
    }

    private ChannelResult send(NotificationChannel channel, NotificationEvent event, NotificationConfig config) {
        String channelId = channel.channelId();
        if (!channel.isConfigured(config)) {
            log.debug("Notification channel not configured channel={}", channelId);
            return ChannelResult.skipped(channelId, "not configured");
        }
        try {
            channel.deliver(event, config);
            log.debug("Notification sent channel={} account={} status={}", channelId, event.accountName(), event.status());
            return ChannelResult.sent(channelId);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver notification channel={} account={}", channelId, event.accountName(), e);
            return ChannelResult.failed(channelId, e.getMessage());
        }
    }
}
