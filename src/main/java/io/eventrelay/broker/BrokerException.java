package io.eventrelay.broker;

/**
 * Raised when the broker rejects a request or cannot be reached.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(final String message) {
        super(message);
    }

    public BrokerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
