package io.eventrelay.delayed.type;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Named FIFO channels for items that must be retried later.
 * <p>
 * A {@link #pull} claims the channel; the claim is released by {@link #ack} (items are
 * discarded) or {@link #nack} (items go back to the front). While claimed, further pulls
 * return nothing.
 *
 * @param <T> item type
 */
public interface DelayedChannel<T> {

    /**
     * Opens a unit of work on the calling thread.
     */
    void begin();

    /**
     * Closes the unit of work opened by {@link #begin()}.
     *
     * @param failure the error that aborted the unit, or {@code null} on success
     */
    void end(Throwable failure);

    void addToQueue(String channel, T item);

    /**
     * @return unclaimed items of the channel, 0 for an unknown channel
     */
    int size(String channel);

    /**
     * @return time since the oldest unclaimed item arrived, empty for an unknown or empty channel
     */
    Optional<Duration> age(String channel);

    /**
     * Claims the channel and takes all of its items.
     *
     * @return the claimed items, empty if the channel is claimed already or has nothing pending
     */
    List<T> pull(String channel);

    /**
     * Claims the channel and takes at most {@code max} of its earliest items.
     */
    List<T> pull(String channel, int max);

    void ack(String channel);

    void nack(String channel);
}
