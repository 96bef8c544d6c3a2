package io.checkin4j.internal;

import io.checkin4j.ExecutionEngine;
import io.checkin4j.core.AccountSpec;
import io.checkin4j.core.AuditLogEntry;
import io.checkin4j.core.ExecutionOutcome;
import io.checkin4j.core.ExecutionStatus;
import io.checkin4j.core.RequestDescriptor;
import io.checkin4j.core.SpecParseException;
import io.checkin4j.notify.NotificationDispatcher;
import io.checkin4j.request.RequestSpecParser;
import io.checkin4j.store.AccountStore;
import io.checkin4j.store.CheckinLogStore;
import io.checkin4j.utils.SecretRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Executes check-ins with a bounded retry loop.
 *
 * <p>Per attempt:
 * <ul>
 *   <li>send the request (the {@link RestClient} carries the per-attempt timeout)</li>
 *   <li>write one audit row with headers and cookies redacted</li>
 *   <li>2xx ends the run; otherwise sleep {@code retryIntervalSeconds} and try again while attempts remain</li>
 * </ul>
 * Exactly one notification goes out per run that got past the account lookup.
 * Sleeps block only the calling worker.
 */
public class DefaultExecutionEngine implements ExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(DefaultExecutionEngine.class);

    static final String MSG_SUCCESS = "Check-in succeeded";
    static final String MSG_HTTP_FAILURE = "Check-in failed: HTTP ";
    static final String MSG_NETWORK_ERROR = "Network error: ";
    static final String MSG_INVALID_SPEC = "Invalid request spec: ";
    static final String MSG_UNEXPECTED = "Unexpected error: ";

    private final AccountStore accountStore;
    private final CheckinLogStore logStore;
    private final NotificationDispatcher notifier;
    private final RestClient restClient;
    private final RequestSpecParser parser;
    private final Clock clock;

    /**
     * What one HTTP attempt produced. {@code statusCode} is null when no response arrived.
     * {@code retryable} is false for errors that would repeat identically.
     */
    private record Attempt(Integer statusCode, String body, String error, boolean retryable) {
        boolean success() {
            return statusCode != null && statusCode >= 200 && statusCode < 300;
        }
    }

    public DefaultExecutionEngine(AccountStore accountStore,
                                  CheckinLogStore logStore,
                                  NotificationDispatcher notifier,
                                  RestClient restClient,
                                  Clock clock) {
        this.accountStore = Objects.requireNonNull(accountStore, "accountStore must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.parser = new RequestSpecParser();
    }

    @Override
    public ExecutionOutcome run(String accountId, boolean skipEnabledCheck) {
        Objects.requireNonNull(accountId, "accountId must not be null");

        Optional<AccountSpec> found = accountStore.findById(accountId);
        if (found.isEmpty()) {
            log.warn("Check-in skipped, account not found id={}", accountId);
            return ExecutionOutcome.failed(accountId, "Account not found: " + accountId, nowInstant());
        }
        AccountSpec account = found.get();

        if (!skipEnabledCheck && !account.enabled()) {
            log.debug("Check-in skipped, account disabled name={} id={}", account.name(), accountId);
            return ExecutionOutcome.skipped(accountId, "Account is disabled", nowInstant());
        }

        RequestDescriptor request;
        try {
            request = parser.parse(account.rawSpec());
        } catch (SpecParseException e) {
            return parseFailure(account, e);
        }

        int maxAttempts = account.retryCount() + 1;
        for (int attempt = 1; ; attempt++) {
            Instant executedAt = nowInstant();
            Attempt result = send(request);
            String logId = logStore.append(auditEntry(accountId, request, result, executedAt));

            if (result.success()) {
                log.info("Check-in succeeded name={} id={} code={} attempt={}/{}",
                        account.name(), accountId, result.statusCode(), attempt, maxAttempts);
                notifyQuietly(account, ExecutionStatus.SUCCESS, result.statusCode(), MSG_SUCCESS, result.body());
                return new ExecutionOutcome(accountId, ExecutionStatus.SUCCESS, result.statusCode(), result.body(),
                        null, executedAt, attempt, logId);
            }

            boolean finalAttempt = attempt >= maxAttempts || !result.retryable();
            if (!finalAttempt) {
                log.warn("Check-in attempt failed name={} id={} attempt={}/{} error={}, retrying in {}s",
                        account.name(), accountId, attempt, maxAttempts, result.error(), account.retryIntervalSeconds());
                try {
                    sleep(Duration.ofSeconds(account.retryIntervalSeconds()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Check-in retry interrupted name={} id={} attempt={}", account.name(), accountId, attempt);
                    finalAttempt = true;
                }
            }

            if (finalAttempt) {
                log.error("Check-in failed name={} id={} attempts={} error={}",
                        account.name(), accountId, attempt, result.error());
                String message = result.statusCode() != null
                        ? MSG_HTTP_FAILURE + result.statusCode()
                        : result.error();
                notifyQuietly(account, ExecutionStatus.FAILED, result.statusCode(), message, result.body());
                return new ExecutionOutcome(accountId, ExecutionStatus.FAILED, result.statusCode(), result.body(),
                        result.error(), executedAt, attempt, logId);
            }
        }
    }

    @Override
    public RequestDescriptor preview(String accountId) {
        Objects.requireNonNull(accountId, "accountId must not be null");
        AccountSpec account = accountStore.findById(accountId)
                .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
        return parser.parse(account.rawSpec());
    }

    /**
     * Blocking pause between attempts (overridable for tests).
     */
    protected void sleep(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    }

    /**
     * Utility: current engine time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    // A parse failure is deterministic: one summary row, one notification, no retry.
    private ExecutionOutcome parseFailure(AccountSpec account, SpecParseException e) {
        Instant at = nowInstant();
        String message = MSG_INVALID_SPEC + e.getMessage();
        log.warn("Check-in failed, invalid request spec name={} id={} reason={}", account.name(), account.id(), e.reason());

        AuditLogEntry entry = new AuditLogEntry(null, account.id(), ExecutionStatus.FAILED, null, null, message, at,
                null, null, null, null, null);
        String logId = logStore.append(entry);

        notifyQuietly(account, ExecutionStatus.FAILED, null, message, null);
        return new ExecutionOutcome(account.id(), ExecutionStatus.FAILED, null, null, message, at, 0, logId);
    }

    private Attempt send(RequestDescriptor request) {
        URI uri;
        HttpMethod method;
        try {
            uri = URI.create(request.url());
            method = HttpMethod.valueOf(request.method());
        } catch (IllegalArgumentException e) {
            return new Attempt(null, null, MSG_INVALID_SPEC + e.getMessage(), false);
        }

        try {
            RestClient.RequestBodySpec spec = restClient.method(method)
                    .uri(uri)
                    .headers(h -> {
                        request.headers().forEach(h::set);
                        if (!request.cookies().isEmpty()) {
                            h.set(HttpHeaders.COOKIE, cookieHeader(h.getFirst(HttpHeaders.COOKIE), request.cookies()));
                        }
                    });
            if (request.hasBody()) {
                if (!hasHeader(request.headers(), HttpHeaders.CONTENT_TYPE)) {
                    spec.contentType(MediaType.APPLICATION_FORM_URLENCODED);
                }
                spec.body(request.body());
            }
            return spec.exchange((req, res) -> new Attempt(res.getStatusCode().value(), res.bodyTo(String.class), null, true));
        } catch (RestClientException e) {
            return new Attempt(null, null, MSG_NETWORK_ERROR + e.getMessage(), true);
        } catch (RuntimeException e) {
            log.error("Unexpected error while sending request url={} msg={}", request.url(), e.getMessage(), e);
            return new Attempt(null, null, MSG_UNEXPECTED + e.getMessage(), false);
        }
    }

    private static AuditLogEntry auditEntry(String accountId, RequestDescriptor request, Attempt result, Instant at) {
        ExecutionStatus status = result.success() ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED;
        String error = result.success()
                ? null
                : (result.statusCode() != null ? "HTTP " + result.statusCode() : result.error());
        return new AuditLogEntry(
                null,
                accountId,
                status,
                result.statusCode(),
                result.body(),
                error,
                at,
                request.method(),
                request.url(),
                SecretRedactor.redactHeaders(request.headers()),
                SecretRedactor.redactCookies(request.cookies()),
                request.body());
    }

    private void notifyQuietly(AccountSpec account, ExecutionStatus status, Integer code, String message, String body) {
        try {
            notifier.fanout(account.name(), status, code, message,
                    ExecutionOutcome.truncate(body, ExecutionOutcome.MAX_BODY_LENGTH));
        } catch (RuntimeException e) {
            log.warn("Notification dispatch failed name={} id={}", account.name(), account.id(), e);
        }
    }

    private static String cookieHeader(String existing, Map<String, String> cookies) {
        String joined = cookies.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
        return (existing == null || existing.isBlank()) ? joined : existing + "; " + joined;
    }

    private static boolean hasHeader(Map<String, String> headers, String name) {
        return headers.keySet().stream().anyMatch(name::equalsIgnoreCase);
    }
}
