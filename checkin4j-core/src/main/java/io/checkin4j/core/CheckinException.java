package io.checkin4j.core;

/**
 * Base type of every failure raised by checkin4j.
 */
public class CheckinException extends RuntimeException {

    public CheckinException(String message) {
        super(message);
    }

    public CheckinException(String message, Throwable cause) {
        super(message, cause);
    }
}
