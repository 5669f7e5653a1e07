package com.ringside.roster.core;

/**
 * Base class for failures raised by the roster lifecycle core.
 * All subclasses are unchecked; callers surface them as user-facing rejections.
 */
public class RosterException extends RuntimeException {

    public RosterException(String message) {
        super(message);
    }

    public RosterException(String message, Throwable cause) {
        super(message, cause);
    }
}
