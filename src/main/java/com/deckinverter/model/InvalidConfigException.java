package com.deckinverter.model;

/**
 * Raised when an inversion configuration cannot be used: malformed colors,
 * out-of-range quality values or an unreadable serialized form.
 * Always fatal for the whole call, before any document is scheduled.
 */
public class InvalidConfigException extends IllegalArgumentException {

    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
