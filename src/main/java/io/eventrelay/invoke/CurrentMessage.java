package io.eventrelay.invoke;

import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * The message whose handler is running on the current thread.
 * <p>
 * Set by {@link SynchronizedInvoker} for the duration of one invocation. Each thread has its
 * own slot, so concurrent invocations never see each other's message. Work handed to other
 * threads sees it only through {@link #propagating(Executor)}.
 */
public final class CurrentMessage {

    private static final ThreadLocal<Object> SLOT = new ThreadLocal<>();

    private CurrentMessage() {
    }

    public static Optional<Object> get() {
        return Optional.ofNullable(SLOT.get());
    }

    public static <M> Optional<M> get(final Class<M> type) {
        final Object current = SLOT.get();
        return type.isInstance(current) ? Optional.of(type.cast(current)) : Optional.empty();
    }

    /**
     * Wraps {@code delegate} so each task runs with the message current at submission time.
     */
    public static Executor propagating(final Executor delegate) {
        return task -> {
            final Object captured = SLOT.get();
            delegate.execute(() -> {
                final Object previous = enter(captured);
                try {
                    task.run();
                } finally {
                    exit(previous);
                }
            });
        };
    }

    /* Returns the value to restore with exit(). */
    static Object enter(final Object message) {
        final Object previous = SLOT.get();
        if (message == null) {
            SLOT.remove();
        } else {
            SLOT.set(message);
        }
        return previous;
    }

    static void exit(final Object previous) {
        if (previous == null) {
            SLOT.remove();
        } else {
            SLOT.set(previous);
        }
    }
}
