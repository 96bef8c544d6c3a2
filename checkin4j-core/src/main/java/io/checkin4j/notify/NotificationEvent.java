package io.checkin4j.notify;

import io.checkin4j.core.ExecutionStatus;

import java.util.Objects;

/**
 * What happened to one execution, in the shape every channel formats from.
 */
public record NotificationEvent(
        String accountName,
        ExecutionStatus status,
        Integer responseCode,
        String message,
        String responseBody
) {
    public NotificationEvent {
        Objects.requireNonNull(accountName, "accountName must not be null");
        Objects.requireNonNull(status, "status must not be null");
        message = message == null ? "" : message;
    }

    /**
     * Short summary used by the chat-bot channels.
     */
    public String chatText() {
        String icon = status == ExecutionStatus.SUCCESS ? "✅" : "❌";
        StringBuilder sb = new StringBuilder()
                .append(icon).append(' ').append(accountName)
                .append('\n').append(message);
        if (responseCode != null) {
            sb.append("\n(HTTP ").append(responseCode).append(')');
        }
        return sb.toString();
    }
}
