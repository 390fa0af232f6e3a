package io.eventrelay.broker;

import java.util.concurrent.CompletableFuture;

/**
 * Abstraction over the event-log service that owns persistent subscriptions.
 * <p>
 * Stream and group creation are the broker's concern; this interface only opens
 * a consumer session against an existing group.
 */
public interface PersistentSubscriptionBroker {

    /**
     * Address of the node the sessions are opened against, used for client identity.
     */
    String endpoint();

    /**
     * Opens a manual-ack session on {@code group} over {@code stream}.
     *
     * @param bufferSize number of events the broker may push ahead of acknowledgements
     * @param listener   receives deliveries and the final drop notification of this session
     * @return completes with the live session, or exceptionally with a {@link BrokerException}
     */
    CompletableFuture<BrokerSession> connect(String stream, String group, int bufferSize, SubscriptionListener listener);
}
