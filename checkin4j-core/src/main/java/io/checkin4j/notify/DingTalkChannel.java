package io.checkin4j.notify;

import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;
import java.util.Map;

/**
 * DingTalk custom robot. With a secret configured, {@code timestamp} (epoch millis) and {@code sign}
 * travel as query parameters.
 */
public class DingTalkChannel extends HttpNotificationChannel {

    public static final String CHANNEL_ID = "dingtalk";

    public DingTalkChannel(RestClient restClient, Clock clock) {
        super(restClient, clock);
    }

    @Override
    public String channelId() {
        return CHANNEL_ID;
    }

    @Override
    public boolean isEnabled(NotificationConfig config) {
        return config.dingTalk().enabled();
    }

    @Override
    public boolean isConfigured(NotificationConfig config) {
        return !NotificationConfig.isBlank(config.dingTalk().accessToken());
    }

    @Override
    public void deliver(NotificationEvent event, NotificationConfig config) {
        NotificationConfig.DingTalk d = config.dingTalk();

        StringBuilder url = new StringBuilder(d.apiUrl())
                .append("/robot/send?access_token=").append(encode(d.accessToken()));
        if (!NotificationConfig.isBlank(d.secret())) {
            String timestamp = String.valueOf(clock.millis());
            String sign = RequestSigner.sign(timestamp, d.secret());
            url.append("&timestamp=").append(timestamp).append("&sign=").append(encode(sign));
        }

        Map<String, Object> payload = Map.of(
                "msgtype", "text",
                "text", Map.of("content", event.chatText()));

        postJson(URI.create(url.toString()), payload);
    }
}
