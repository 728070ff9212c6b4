package com.jobpulse.common;

import lombok.Getter;

/**
 * Thrown when an event cannot be classified or fails validation before merge. Never retried.
 */
@Getter
public class EventRejectedException extends RuntimeException {

    private final ErrorKind errorKind;

    public EventRejectedException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public static EventRejectedException unrecognized(String discriminator) {
        return new EventRejectedException(ErrorKind.UNRECOGNIZED_EVENT_KIND, "Unrecognized event kind: " + discriminator);
    }

    public static EventRejectedException malformed(String message) {
        return new EventRejectedException(ErrorKind.MALFORMED_EVENT, message);
    }

    public static EventRejectedException invalidData(String message) {
        return new EventRejectedException(ErrorKind.INVALID_EVENT_DATA, message);
    }
}
