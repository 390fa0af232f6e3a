package io.eventrelay.broker;

import io.eventrelay.core.model.ResolvedEvent;

import java.time.Duration;
import java.util.List;

/**
 * One live connection to a persistent subscription group.
 */
public interface BrokerSession {

    /**
     * Acknowledges a batch of events delivered on this session.
     * Batches larger than the broker's limit are rejected, callers chunk them.
     *
     * @throws BrokerException if the broker refused the batch
     */
    void acknowledge(List<ResolvedEvent> events);

    /**
     * Stops the session; the listener receives a {@link DropReason#USER_INITIATED} drop.
     */
    void stop(Duration timeout);
}
