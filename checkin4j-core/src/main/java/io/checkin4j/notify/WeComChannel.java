package io.checkin4j.notify;

import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;
import java.util.Map;

public class WeComChannel extends HttpNotificationChannel {

    public static final String CHANNEL_ID = "wecom";

    public WeComChannel(RestClient restClient, Clock clock) {
        super(restClient, clock);
    }

    @Override
    public String channelId() {
        return CHANNEL_ID;
    }

    @Override
    public boolean isEnabled(NotificationConfig config) {
        return config.weCom().enabled();
    }

    @Override
    public boolean isConfigured(NotificationConfig config) {
        return !NotificationConfig.isBlank(config.weCom().webhookKey());
    }

    @Override
    public void deliver(NotificationEvent event, NotificationConfig config) {
        NotificationConfig.WeCom w = config.weCom();
        URI uri = URI.create(w.apiUrl() + "/cgi-bin/webhook/send?key=" + encode(w.webhookKey()));

        Map<String, Object> payload = Map.of(
                "msgtype", "text",
                "text", Map.of("content", event.chatText()));

        postJson(uri, payload);
    }
}
