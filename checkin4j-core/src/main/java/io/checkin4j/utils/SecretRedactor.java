package io.checkin4j.utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials before a request is written to the audit log.
 */
public final class SecretRedactor {
    private SecretRedactor() {
    }

    public static final String REDACTED = "***REDACTED***";

    private static final String MASK = "***";
    private static final int COOKIE_VISIBLE_CHARS = 4;

    private static final Set<String> SENSITIVE_HEADERS = Set.of(
            "authorization", "x-api-key", "x-auth-token", "api-key",
            "token", "secret", "password", "apikey"
    );

    public static Map<String, String> redactHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((name, value) -> out.put(name, redactHeader(name, value)));
        return Collections.unmodifiableMap(out);
    }

    public static Map<String, String> redactCookies(Map<String, String> cookies) {
        if (cookies == null || cookies.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        cookies.forEach((name, value) -> out.put(name, maskCookieValue(value)));
        return Collections.unmodifiableMap(out);
    }

    public static boolean isSensitiveHeader(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return SENSITIVE_HEADERS.contains(lower) || lower.contains("auth");
    }

    public static String maskCookieValue(String value) {
        if (value == null || value.length() <= COOKIE_VISIBLE_CHARS) {
            return MASK;
        }
        return value.substring(0, COOKIE_VISIBLE_CHARS) + MASK;
    }

    private static String redactHeader(String name, String value) {
        if (isSensitiveHeader(name)) {
            return REDACTED;
        }
        if ("cookie".equalsIgnoreCase(name) && value != null) {
            return maskCookieHeader(value);
        }
        return value;
    }

    private static String maskCookieHeader(String header) {
        StringBuilder sb = new StringBuilder();
        for (String item : header.split(";")) {
            String pair = item.trim();
            if (pair.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("; ");
            }
            int eq = pair.indexOf('=');
            if (eq < 0) {
                sb.append(maskCookieValue(pair));
            } else {
                sb.append(pair, 0, eq + 1).append(maskCookieValue(pair.substring(eq + 1).trim()));
            }
        }
        return sb.toString();
    }
}
