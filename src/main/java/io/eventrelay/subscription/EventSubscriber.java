package io.eventrelay.subscription;

/**
 * Consumes a persistent subscription until cancelled or closed.
 */
public interface EventSubscriber extends AutoCloseable {

    /**
     * Connects and starts consuming; returns once every shard is connected.
     */
    void subscribe(Cancellation cancellation);

    @Override
    void close();
}
