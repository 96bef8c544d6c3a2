package io.checkin4j.notify;

import org.springframework.web.client.RestClient;
import org.springframework.web.util.HtmlUtils;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

public class TelegramChannel extends HttpNotificationChannel {

    public static final String CHANNEL_ID = "telegram";

    public TelegramChannel(RestClient restClient, Clock clock) {
        super(restClient, clock);
    }

    @Override
    public String channelId() {
        return CHANNEL_ID;
    }

    @Override
    public boolean isEnabled(NotificationConfig config) {
        return config.telegram().enabled();
    }

    @Override
    public boolean isConfigured(NotificationConfig config) {
        NotificationConfig.Telegram t = config.telegram();
        return !NotificationConfig.isBlank(t.botToken()) && !NotificationConfig.isBlank(t.chatId());
    }

    @Override
    public void deliver(NotificationEvent event, NotificationConfig config) {
        NotificationConfig.Telegram t = config.telegram();
        URI uri = URI.create(t.apiUrl() + "/bot" + t.botToken() + "/sendMessage");

        // parse_mode HTML: the account name and message are user text
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", t.chatId());
        payload.put("text", HtmlUtils.htmlEscape(event.chatText(), "UTF-8"));
        payload.put("parse_mode", "HTML");

        postJson(uri, payload);
    }
}
