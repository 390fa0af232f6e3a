package io.eventrelay.invoke;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Runs asynchronous handler invocations from synchronous processing code.
 * <p>
 * {@link #invoke} blocks the calling thread until the invocation's stage completes, and
 * publishes the message through {@link CurrentMessage} for as long as it runs. The slot is
 * restored on every exit path, so nested invocations see their own message and the outer
 * one again once they return.
 * </p>
 *
 * <p>
 * Blocking serializes one handler per calling thread. Pipelines that are themselves
 * asynchronous should use {@link #invokeAsync} instead.
 * </p>
 */
public final class SynchronizedInvoker {

    /**
     * Invokes and waits for completion.
     *
     * @throws HandlerInvocationException for checked handler failures and interrupted waits
     * @throws java.util.concurrent.CancellationException if the handler's stage was cancelled
     */
    public <M> void invoke(final HandlerInvocation<M> invocation, final M message) {
        final Object previous = CurrentMessage.enter(message);
        try {
            final CompletionStage<?> stage = invocation.invoke(message);
            if (stage != null) {
                await(stage, message);
            }
        } catch (final RuntimeException | Error e) {
            throw e;
        } catch (final Exception e) {
            throw new HandlerInvocationException(failureMessage(message), e);
        } finally {
            CurrentMessage.exit(previous);
        }
    }

    /**
     * Starts the invocation with {@code message} current and returns without waiting.
     * Only the synchronous part of the handler sees the message through {@link CurrentMessage}.
     */
    public <M> CompletableFuture<Void> invokeAsync(final HandlerInvocation<M> invocation, final M message) {
        final Object previous = CurrentMessage.enter(message);
        try {
            final CompletionStage<?> stage = invocation.invoke(message);
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.toCompletableFuture().thenApply(ignored -> null);
        } catch (final Exception e) {
            return CompletableFuture.failedFuture(e);
        } finally {
            CurrentMessage.exit(previous);
        }
    }

    private static void await(final CompletionStage<?> stage, final Object message) {
        try {
            stage.toCompletableFuture().get();
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new HandlerInvocationException("Interrupted while waiting for handler of "
                    + describe(message), ie);
        } catch (final ExecutionException ee) {
            final Throwable cause = ee.getCause() == null ? ee : ee.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new HandlerInvocationException(failureMessage(message), cause);
        }
    }

    private static String failureMessage(final Object message) {
        return "Handler failed for " + describe(message);
    }

    private static String describe(final Object message) {
        return message == null ? "null message" : message.getClass().getSimpleName();
    }
}
