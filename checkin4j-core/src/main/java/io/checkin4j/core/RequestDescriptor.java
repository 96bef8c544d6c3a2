package io.checkin4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured HTTP request produced from a raw request spec.
 * Header and cookie maps keep insertion order; header names keep the case they were given in.
 */
public record RequestDescriptor(
        String method,
        String url,
        Map<String, String> headers,
        Map<String, String> cookies,
        String body
) {
    public RequestDescriptor {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        cookies = cookies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }
}
