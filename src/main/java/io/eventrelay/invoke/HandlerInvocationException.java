package io.eventrelay.invoke;

/**
 * Wraps a checked failure of a handler invocation, or an interrupted wait for one.
 */
public class HandlerInvocationException extends RuntimeException {

    public HandlerInvocationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
