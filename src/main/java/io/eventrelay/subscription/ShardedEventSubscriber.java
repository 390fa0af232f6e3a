package io.eventrelay.subscription;

import io.eventrelay.broker.PersistentSubscriptionBroker;
import io.eventrelay.config.impl.SubscriptionConfig;
import io.eventrelay.core.model.ResolvedEvent;
import io.eventrelay.delayed.type.DelayedChannel;
import io.eventrelay.exception.SubscriptionInvariantException;
import io.eventrelay.invoke.HandlerInvocation;
import io.eventrelay.invoke.SynchronizedInvoker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * Runs one {@link PersistentClient} per shard and a consumer thread for each.
 * <p>
 * Every dequeued event is dispatched through {@link SynchronizedInvoker}, so the handler
 * can look it up as the current message. Handled events are acknowledged. Events whose
 * handler fails are parked on the retry channel and acknowledged to the broker; a
 * background drain redispatches them one at a time, returning an item to the channel
 * whenever it fails again.
 * </p>
 *
 * <p>
 * Ack flushes and reconnects of all clients share one scheduler thread that never runs
 * handler code. The retry drain has a thread of its own.
 * </p>
 *
 * <p>
 * A fatal invariant break on any shard, a {@link VirtualMachineError} in a handler, or
 * any other failure escaping a consumer loop or the retry drain cancels the whole
 * subscriber.
 * </p>
 */
@Slf4j
public final class ShardedEventSubscriber implements EventSubscriber {

    private static final Marker ALERT = MarkerFactory.getMarker("ALERT");

    private final PersistentSubscriptionBroker broker;
    private final SubscriptionConfig config;
    private final HandlerInvocation<ResolvedEvent> dispatcher;
    private final DelayedChannel<ResolvedEvent> retries;
    private final MeterRegistry registry;
    private final SynchronizedInvoker invoker = new SynchronizedInvoker();

    private final List<PersistentClient> clients = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    private volatile Cancellation cancellation;
    private ExecutorService consumers;
    private ScheduledExecutorService scheduler;
    private ScheduledExecutorService retryScheduler;
    private ScheduledFuture<?> retryDrain;

    public ShardedEventSubscriber(final PersistentSubscriptionBroker broker,
                                  final SubscriptionConfig config,
                                  final HandlerInvocation<ResolvedEvent> dispatcher,
                                  final DelayedChannel<ResolvedEvent> retries,
                                  final MeterRegistry registry) {
        this.broker = broker;
        this.config = config.validate();
        this.dispatcher = dispatcher;
        this.retries = retries;
        this.registry = registry;
    }

    @Override
    public void subscribe(final Cancellation cancellation) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Subscriber for " + config.getStream() + " already started");
        }
        this.cancellation = cancellation;

        final int shards = config.getShards();
        scheduler = Executors.newSingleThreadScheduledExecutor(daemon("subscriber-" + config.getGroup()));
        retryScheduler = Executors.newSingleThreadScheduledExecutor(daemon("retry-" + config.getGroup()));
        consumers = Executors.newFixedThreadPool(shards, daemon("consumer-" + config.getGroup()));

        final List<CompletableFuture<Void>> connects = new ArrayList<>(shards);
        for (int i = 0; i < shards; i++) {
            final PersistentClient client = new PersistentClient(broker, i, config, cancellation, registry, scheduler);
            client.setFatalErrorHandler(this::onFatal);
            clients.add(client);
            connects.add(client.connect());
        }
        CompletableFuture.allOf(connects.toArray(new CompletableFuture[0])).join();

        log.info("Subscribed to [{}] group [{}] with {} shards", config.getStream(), config.getGroup(), shards);

        for (final PersistentClient client : clients) {
            consumers.submit(() -> consume(client));
        }

        final long period = config.getRetryInterval().toMillis();
        retryDrain = retryScheduler.scheduleWithFixedDelay(this::runRetryDrain, period, period, TimeUnit.MILLISECONDS);
    }

    public List<PersistentClient> getClients() {
        return List.copyOf(clients);
    }

    /**
     * The failure that cancelled this subscriber, if any: a {@link SubscriptionInvariantException}
     * from a client, or whatever escaped a consumer loop or the retry drain.
     */
    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure.get());
    }

    @Override
    public void close() {
        if (!started.get() || !closed.compareAndSet(false, true)) return;

        cancellation.cancel();
        if (retryDrain != null) {
            retryDrain.cancel(false);
        }
        retryScheduler.shutdownNow();

        consumers.shutdown();
        try {
            if (!consumers.awaitTermination(config.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consumers of {} did not stop within {}", config.getGroup(), config.getShutdownGrace());
                consumers.shutdownNow();
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            consumers.shutdownNow();
        }

        for (final PersistentClient client : clients) {
            try {
                client.close();
            } catch (final RuntimeException e) {
                log.error("Failed to close subscription client {}", client.getId(), e);
            }
        }
        scheduler.shutdownNow();
        log.info("Subscriber for [{}] group [{}] closed", config.getStream(), config.getGroup());
    }

    private void consume(final PersistentClient client) {
        final long parkNanos = config.getPollInterval().toNanos();
        try {
            while (!cancellation.isCancelled() && !client.isFailed()) {
                final Optional<ResolvedEvent> next = client.tryDequeue();
                if (next.isEmpty()) {
                    LockSupport.parkNanos(parkNanos);
                    continue;
                }
                handle(client, next.get());
            }
            log.debug("Consumer of {} stopped", client.getId());
        } catch (final Throwable t) {
            // Nothing reads the consumer's future; the failure is reported here.
            fail("consumer of " + client.getId(), t);
        }
    }

    private void handle(final PersistentClient client, final ResolvedEvent event) {
        final Throwable error = dispatch(event);
        if (error instanceof Error) {
            log.error(ALERT, "ALERT: handler raised {} for event {} on {}, parking it for retry",
                    error.getClass().getSimpleName(), event.eventId(), client.getId(), error);
            retries.addToQueue(config.getRetryChannel(), event);
        } else if (error != null) {
            log.warn("Handler failed for event {} on {}, parking it for retry", event.eventId(), client.getId(), error);
            retries.addToQueue(config.getRetryChannel(), event);
        }

        if (!client.isLive()) {
            // The session went away while handling; the broker redelivers the event.
            log.debug("Session of {} dropped while handling {}", client.getId(), event.eventId());
            return;
        }
        client.acknowledge(event);
    }

    /*
     * Returns the handler failure, null on success. A VirtualMachineError is rethrown
     * after the unit of work is rolled back.
     */
    private Throwable dispatch(final ResolvedEvent event) {
        Throwable error = null;
        retries.begin();
        try {
            invoker.invoke(dispatcher, event);
        } catch (final VirtualMachineError e) {
            error = e;
            throw e;
        } catch (final Throwable t) {
            error = t;
        } finally {
            retries.end(error);
        }
        return error;
    }

    private void runRetryDrain() {
        try {
            drainRetries();
        } catch (final Throwable t) {
            // an escaping throwable would silently cancel the periodic task
            fail("retry drain of " + config.getRetryChannel(), t);
        }
    }

    void drainRetries() {
        final String channel = config.getRetryChannel();
        for (int i = 0; i < config.getRetryBatchSize() && !cancellation.isCancelled(); i++) {
            final List<ResolvedEvent> items = retries.pull(channel, 1);
            if (items.isEmpty()) return;

            final ResolvedEvent event = items.get(0);
            final Throwable error;
            try {
                error = dispatch(event);
            } catch (final VirtualMachineError e) {
                retries.nack(channel);
                throw e;
            }
            if (error == null) {
                retries.ack(channel);
                continue;
            }

            retries.nack(channel);
            log.warn("Retry of event {} failed, {} events waiting on {}",
                    event.eventId(), retries.size(channel), channel, error);
            return;
        }
    }

    private void onFatal(final PersistentClient client, final SubscriptionInvariantException error) {
        failure.compareAndSet(null, error);
        log.error("Cancelling subscriber for [{}] after fatal error on {}", config.getStream(), client.getId());
        cancellation.cancel();
    }

    private void fail(final String where, final Throwable error) {
        failure.compareAndSet(null, error);
        log.error(ALERT, "ALERT: {} of [{}] failed, cancelling subscriber", where, config.getStream(), error);
        cancellation.cancel();
    }

    private static ThreadFactory daemon(final String prefix) {
        final AtomicInteger seq = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
