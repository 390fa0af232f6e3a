package io.eventrelay.broker;

import io.eventrelay.core.model.ResolvedEvent;

/**
 * Callbacks invoked on broker-owned threads for a single session.
 */
public interface SubscriptionListener {

    void eventDelivered(BrokerSession session, ResolvedEvent event);

    /**
     * Called exactly once when the session ends, whatever the cause.
     *
     * @param error the failure that ended the session, {@code null} for clean stops
     */
    void sessionDropped(BrokerSession session, DropReason reason, Throwable error);
}
