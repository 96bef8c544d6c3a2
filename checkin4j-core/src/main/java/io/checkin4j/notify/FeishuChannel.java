package io.checkin4j.notify;

import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feishu custom bot. With a secret configured, {@code timestamp} (epoch seconds) and {@code sign}
 * are added to the JSON body.
 */
public class FeishuChannel extends HttpNotificationChannel {

    public static final String CHANNEL_ID = "feishu";

    public FeishuChannel(RestClient restClient, Clock clock) {
        super(restClient, clock);
    }

    @Override
    public String channelId() {
        return CHANNEL_ID;
    }

    @Override
    public boolean isEnabled(NotificationConfig config) {
        return config.feishu().enabled();
    }

    @Override
    public boolean isConfigured(NotificationConfig config) {
        return !NotificationConfig.isBlank(config.feishu().webhookUrl());
    }

    @Override
    public void deliver(NotificationEvent event, NotificationConfig config) {
        NotificationConfig.Feishu f = config.feishu();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("msg_type", "text");
        payload.put("content", Map.of("text", event.chatText()));
        if (!NotificationConfig.isBlank(f.secret())) {
            String timestamp = String.valueOf(clock.instant().getEpochSecond());
            payload.put("timestamp", timestamp);
            payload.put("sign", RequestSigner.sign(timestamp, f.secret()));
        }

        postJson(URI.create(f.webhookUrl().trim()), payload);
    }
}
