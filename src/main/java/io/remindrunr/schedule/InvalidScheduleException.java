package io.remindrunr.schedule;

/**
 * Thrown when a schedule definition or one of its triggers is malformed.
 * Raised synchronously when a definition is created or updated, never at fire time.
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
