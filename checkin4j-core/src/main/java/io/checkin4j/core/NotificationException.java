package io.checkin4j.core;

/**
 * A notification channel could not deliver a message.
 * Only ever seen inside the dispatcher, which logs it and moves on.
 */
public class NotificationException extends CheckinException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
