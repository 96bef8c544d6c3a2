package io.checkin4j.core;

/**
 * Account, log or config store failure. Propagated to the caller and never retried.
 */
public class PersistenceException extends CheckinException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
