package io.checkin4j.notify;

import io.checkin4j.core.NotificationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Generic webhook with a fixed payload:
 * {@code {title, account_name, status, response_code, date, message, response_body?}}.
 * <p>
 * POST bodies follow the configured {@code Content-Type}:
 * <ul>
 *   <li>{@code multipart/form-data}: form parts, boundary generated by the HTTP layer</li>
 *   <li>{@code application/x-www-form-urlencoded}: url-encoded form</li>
 *   <li>anything else: JSON</li>
 * </ul>
 * Any other method sends the fields as query parameters of a GET.
 */
public class WebhookChannel extends HttpNotificationChannel {

    public static final String CHANNEL_ID = "webhook";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public WebhookChannel(RestClient restClient, Clock clock) {
        super(restClient, clock);
    }

    @Override
    public String channelId() {
        return CHANNEL_ID;
    }

    @Override
    public boolean isEnabled(NotificationConfig config) {
        return config.webhook().enabled();
    }

    @Override
    public boolean isConfigured(NotificationConfig config) {
        return !NotificationConfig.isBlank(config.webhook().url());
    }

    @Override
    public void deliver(NotificationEvent event, NotificationConfig config) {
        NotificationConfig.Webhook w = config.webhook();
        Map<String, Object> payload = payload(event, w.includeResponse());

        Map<String, String> headers = new LinkedHashMap<>(w.headers());
        String contentTypeKey = findHeader(headers, HttpHeaders.CONTENT_TYPE);

        try {
            if ("POST".equals(w.method())) {
                String contentType = contentTypeKey == null
                        ? MediaType.APPLICATION_JSON_VALUE
                        : headers.get(contentTypeKey).toLowerCase(Locale.ROOT);
                if (contentTypeKey != null) {
                    headers.remove(contentTypeKey);
                }

                RestClient.RequestBodySpec request = restClient.post()
                        .uri(URI.create(w.url().trim()))
                        .headers(h -> headers.forEach(h::set));

                if (contentType.contains(MediaType.MULTIPART_FORM_DATA_VALUE)) {
                    MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
                    formFields(payload).forEach(parts::add);
                    request.contentType(MediaType.MULTIPART_FORM_DATA).body(parts);
                } else if (contentType.contains(MediaType.APPLICATION_FORM_URLENCODED_VALUE)) {
                    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                    formFields(payload).forEach(form::add);
                    request.contentType(MediaType.APPLICATION_FORM_URLENCODED).body(form);
                } else {
                    request.contentType(MediaType.APPLICATION_JSON).body(payload);
                }
                request.retrieve().toBodilessEntity();
            } else {
                // values go in as URI variables so reserved characters such as '+' are percent-encoded
                Map<String, String> fields = formFields(payload);
                UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(w.url().trim());
                fields.keySet().forEach(k -> builder.queryParam(k, "{" + k + "}"));
                restClient.get()
                        .uri(builder.encode().buildAndExpand(fields).toUri())
                        .headers(h -> headers.forEach(h::set))
                        .retrieve()
                        .toBodilessEntity();
            }
        } catch (RestClientException e) {
            throw new NotificationException("webhook delivery failed: " + e.getMessage(), e);
        }
    }

    Map<String, Object> payload(NotificationEvent event, boolean includeResponse) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", event.accountName());
        payload.put("account_name", event.accountName());
        payload.put("status", event.status().value());
        payload.put("response_code", event.responseCode());
        payload.put("date", LocalDateTime.now(clock).format(DATE_FORMAT));
        payload.put("message", event.message());
        if (includeResponse && event.responseBody() != null && !event.responseBody().isEmpty()) {
            payload.put("response_body", event.responseBody());
        }
        return payload;
    }

    // form and query encodings have no null, so absent values are left out
    private static Map<String, String> formFields(Map<String, Object> payload) {
        Map<String, String> fields = new LinkedHashMap<>();
        payload.forEach((k, v) -> {
            if (v != null) {
                fields.put(k, String.valueOf(v));
            }
        });
        return fields;
    }

    private static String findHeader(Map<String, String> headers, String name) {
        for (String key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return key;
            }
        }
        return null;
    }
}
