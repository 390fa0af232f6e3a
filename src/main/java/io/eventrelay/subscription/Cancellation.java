package io.eventrelay.subscription;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by the clients and loops of one subscription.
 * Holders poll it at their own checkpoints; nothing is interrupted.
 */
public final class Cancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
