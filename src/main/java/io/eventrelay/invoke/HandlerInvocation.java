package io.eventrelay.invoke;

import java.util.concurrent.CompletionStage;

/**
 * An asynchronous call into application handler code for one message.
 *
 * @param <M> message type
 */
@FunctionalInterface
public interface HandlerInvocation<M> {

    /**
     * Starts handling {@code message}.
     *
     * @return a stage completing when the handler is done, or {@code null} if it finished synchronously
     */
    CompletionStage<?> invoke(M message) throws Exception;
}
