package io.checkin4j.notify;

import io.checkin4j.core.NotificationException;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;

/**
 * Base for channels that talk HTTP through a shared {@link RestClient}.
 * The client carries the per-send timeout.
 */
public abstract class HttpNotificationChannel implements NotificationChannel {

    protected final RestClient restClient;
    protected final Clock clock;

    protected HttpNotificationChannel(RestClient restClient, Clock clock) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * POSTs {@code payload} as JSON; any transport error or non-2xx answer becomes a {@link NotificationException}.
     */
    protected void postJson(URI uri, Object payload) {
        try {
            restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new NotificationException(channelId() + " delivery failed: " + e.getMessage(), e);
        }
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
