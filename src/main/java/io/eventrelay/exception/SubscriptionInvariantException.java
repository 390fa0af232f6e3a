package io.eventrelay.exception;

/**
 * An unrecoverable break of the acknowledgement protocol.
 * <p>
 * Raised when acknowledgements could no longer be matched to the connection that
 * delivered the events. The affected subscription client stops; continuing would let
 * acknowledged positions drift away from the broker's view.
 */
public class SubscriptionInvariantException extends RuntimeException {

    private final String clientId;

    public SubscriptionInvariantException(final String clientId, final String message) {
        super(message);
        this.clientId = clientId;
    }

    public String getClientId() {
        return clientId;
    }
}
