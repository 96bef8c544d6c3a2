package io.checkin4j.core;

import java.util.Objects;

/**
 * A request spec could not be turned into a {@link RequestDescriptor}.
 * Never retried: parsing is deterministic.
 */
public class SpecParseException extends CheckinException {

    public enum Reason {
        MISSING_URL,
        MALFORMED_QUOTING,
        SPEC_TOO_LONG
    }

    private final Reason reason;

    public SpecParseException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason reason() {
        return reason;
    }
}
