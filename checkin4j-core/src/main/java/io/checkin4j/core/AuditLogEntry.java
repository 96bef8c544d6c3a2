package io.checkin4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One persisted execution attempt. Headers and cookies are already redacted.
 * Immutable once written; removed only by retention or when its account is deleted.
 */
public record AuditLogEntry(
        String id,
        String accountId,

        // outcome
        ExecutionStatus status,
        Integer responseCode,
        String responseBody,
        String errorMessage,
        Instant executedAt,

        // redacted request
        String requestMethod,
        String requestUrl,
        Map<String, String> requestHeaders,
        Map<String, String> requestCookies,
        String requestData
) {
    public AuditLogEntry {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(executedAt, "executedAt must not be null");
        responseBody = ExecutionOutcome.truncate(responseBody, ExecutionOutcome.MAX_BODY_LENGTH);
        errorMessage = ExecutionOutcome.truncate(errorMessage, ExecutionOutcome.MAX_ERROR_LENGTH);
        requestHeaders = requestHeaders == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requestHeaders));
        requestCookies = requestCookies == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requestCookies));
    }

    public AuditLogEntry withId(String newId) {
        return new AuditLogEntry(newId, accountId, status, responseCode, responseBody, errorMessage, executedAt,
                requestMethod, requestUrl, requestHeaders, requestCookies, requestData);
    }
}
