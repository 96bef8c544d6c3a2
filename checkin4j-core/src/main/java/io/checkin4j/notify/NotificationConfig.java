package io.checkin4j.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.checkin4j.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Typed snapshot of every channel's settings.
 * <p>
 * Loaded from the {@link ConfigStore} on each dispatch so that edits apply to the next notification.
 */
public record NotificationConfig(
        Webhook webhook,
        Telegram telegram,
        DingTalk dingTalk,
        WeCom weCom,
        Feishu feishu
) {
    private static final Logger log = LoggerFactory.getLogger(NotificationConfig.class);

    public static final String DEFAULT_WEBHOOK_METHOD = "POST";
    public static final String DEFAULT_TELEGRAM_API_URL = "https://api.telegram.org";
    public static final String DEFAULT_DINGTALK_API_URL = "https://oapi.dingtalk.com";
    public static final String DEFAULT_WECOM_API_URL = "https://qyapi.weixin.qq.com";

    public record Webhook(boolean enabled, String url, String method, Map<String, String> headers,
                          boolean includeResponse) {
        public Webhook {
            method = isBlank(method) ? DEFAULT_WEBHOOK_METHOD : method.trim().toUpperCase(Locale.ROOT);
            headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        }
    }

    public record Telegram(boolean enabled, String botToken, String chatId, String apiUrl) {
        public Telegram {
            apiUrl = baseUrl(apiUrl, DEFAULT_TELEGRAM_API_URL);
        }
    }

    public record DingTalk(boolean enabled, String accessToken, String secret, String apiUrl) {
        public DingTalk {
            apiUrl = baseUrl(apiUrl, DEFAULT_DINGTALK_API_URL);
        }
    }

    public record WeCom(boolean enabled, String webhookKey, String apiUrl) {
        public WeCom {
            apiUrl = baseUrl(apiUrl, DEFAULT_WECOM_API_URL);
        }
    }

    public record Feishu(boolean enabled, String webhookUrl, String secret) {
    }

    public static NotificationConfig load(ConfigStore store, ObjectMapper objectMapper) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");

        Webhook webhook = new Webhook(
                store.isTrue("webhook_enabled"),
                value(store, "webhook_url"),
                value(store, "webhook_method"),
                parseHeaders(value(store, "webhook_headers"), objectMapper),
                store.isTrue("webhook_include_response"));

        Telegram telegram = new Telegram(
                store.isTrue("telegram_enabled"),
                value(store, "telegram_bot_token"),
                value(store, "telegram_user_id"),
                value(store, "telegram_api_url"));

        DingTalk dingTalk = new DingTalk(
                store.isTrue("dingtalk_enabled"),
                value(store, "dingtalk_access_token"),
                value(store, "dingtalk_secret"),
                value(store, "dingtalk_api_url"));

        WeCom weCom = new WeCom(
                store.isTrue("wecom_enabled"),
                value(store, "wecom_webhook_key"),
                value(store, "wecom_api_url"));

        Feishu feishu = new Feishu(
                store.isTrue("feishu_enabled"),
                value(store, "feishu_webhook_url"),
                value(store, "feishu_secret"));

        return new NotificationConfig(webhook, telegram, dingTalk, weCom, feishu);
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String value(ConfigStore store, String key) {
        return store.get(key).filter(v -> !v.isBlank()).orElse(null);
    }

    private static String baseUrl(String configured, String fallback) {
        String base = isBlank(configured) ? fallback : configured.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private static Map<String, String> parseHeaders(String json, ObjectMapper objectMapper) {
        if (isBlank(json)) {
            return Map.of();
        }
        try {
            Map<String, Object> raw = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
            Map<String, String> headers = new LinkedHashMap<>();
            raw.forEach((k, v) -> {
                if (v != null) {
                    headers.put(k, String.valueOf(v));
                }
            });
            return headers;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring webhook_headers, not a JSON object: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
