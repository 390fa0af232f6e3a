package io.eventrelay.subscription;

import io.eventrelay.exception.SubscriptionInvariantException;

/**
 * Notified when a {@link PersistentClient} stops on a broken acknowledgement invariant.
 */
@FunctionalInterface
public interface FatalErrorHandler {

    FatalErrorHandler NONE = (client, error) -> { };

    void onFatal(PersistentClient client, SubscriptionInvariantException error);
}
