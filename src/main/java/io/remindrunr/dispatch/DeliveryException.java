package io.remindrunr.dispatch;

/**
 * Raised when an outbound delivery fails: HTTP error, timeout, transport error or missing configuration.
 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
