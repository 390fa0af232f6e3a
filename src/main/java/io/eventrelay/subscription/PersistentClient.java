package io.eventrelay.subscription;

import io.eventrelay.broker.BrokerSession;
import io.eventrelay.broker.DropReason;
import io.eventrelay.broker.PersistentSubscriptionBroker;
import io.eventrelay.broker.SubscriptionListener;
import io.eventrelay.config.impl.SubscriptionConfig;
import io.eventrelay.core.model.ResolvedEvent;
import io.eventrelay.exception.SubscriptionInvariantException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client for one shard of a persistent subscription group.
 * <p>
 * The broker pushes events on its own threads; they are buffered here until a consumer
 * pulls them with {@link #tryDequeue()}. Events handed back through
 * {@link #acknowledge(ResolvedEvent)} are collected and sent to the broker by a background
 * task every {@code flushInterval}, in chunks of at most {@code ackBatchSize}.
 * </p>
 *
 * <p>
 * Delivery is at-least-once. Buffered events of a dropped session are discarded because
 * the broker redelivers them after the reconnect, and events dequeued from a severed
 * session are never acknowledged on its successor.
 * </p>
 */
@Slf4j
public final class PersistentClient implements AutoCloseable {

    private static final Marker ALERT = MarkerFactory.getMarker("ALERT");

    private final PersistentSubscriptionBroker broker;
    private final String stream;
    private final String group;
    private final int index;
    private final SubscriptionConfig config;
    private final Cancellation cancellation;

    @Getter
    private final String id;
    @Getter
    private final SubscriptionMetrics metrics;

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ScheduledFuture<?> acknowledger;

    private final ConcurrentLinkedQueue<Delivered> waitingEvents = new ConcurrentLinkedQueue<>();

    /* eventId -> generation of the connection that delivered it */
    private final Map<UUID, Long> outstanding = new ConcurrentHashMap<>();

    /* Guards toAck, and orders acknowledgements against drops. */
    private final Object ackLock = new Object();
    private List<ResolvedEvent> toAck = new ArrayList<>();

    private final AtomicLong generation = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean failed = new AtomicBoolean(false);

    private volatile BrokerSession session;
    private volatile boolean live;
    private volatile Timer.Sample idleSample;
    private volatile FatalErrorHandler fatalErrorHandler = FatalErrorHandler.NONE;

    public PersistentClient(final PersistentSubscriptionBroker broker,
                            final int index,
                            final SubscriptionConfig config,
                            final Cancellation cancellation,
                            final MeterRegistry registry) {
        this(broker, index, config, cancellation, registry, null);
    }

    /**
     * @param scheduler runs the ack flush and reconnects; when {@code null} the client owns a
     *                  single daemon thread and shuts it down on {@link #close()}
     */
    public PersistentClient(final PersistentSubscriptionBroker broker,
                            final int index,
                            final SubscriptionConfig config,
                            final Cancellation cancellation,
                            final MeterRegistry registry,
                            final ScheduledExecutorService scheduler) {
        this.broker = broker;
        this.stream = config.getStream();
        this.group = config.getGroup();
        this.index = index;
        this.config = config;
        this.cancellation = cancellation;
        this.id = broker.endpoint() + "." + stream.substring(stream.lastIndexOf('.') + 1) + "." + index;
        this.metrics = new SubscriptionMetrics(registry, id);

        if (scheduler == null) {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "ack-flusher-" + id);
                t.setDaemon(true);
                return t;
            });
            this.ownsScheduler = true;
        } else {
            this.scheduler = scheduler;
            this.ownsScheduler = false;
        }

        final long period = config.getFlushInterval().toMillis();
        this.acknowledger = this.scheduler.scheduleWithFixedDelay(
                this::flushAcknowledgements, period, period, TimeUnit.MILLISECONDS);
    }

    public boolean isLive() {
        return live;
    }

    public boolean isFailed() {
        return failed.get();
    }

    public int getIndex() {
        return index;
    }

    public void setFatalErrorHandler(final FatalErrorHandler handler) {
        this.fatalErrorHandler = handler == null ? FatalErrorHandler.NONE : handler;
    }

    /**
     * Opens a new session; also used for every reconnect.
     */
    public CompletableFuture<Void> connect() {
        if (closed.get() || failed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Client " + id + " is stopped"));
        }

        final long gen = generation.incrementAndGet();
        final ConnectionListener listener = new ConnectionListener(gen);

        log.info("Connecting to subscription group [{}] on {} as {}", group, broker.endpoint(), id);
        return broker.connect(stream, group, config.getReadSize(), listener)
                .thenAccept(s -> {
                    synchronized (ackLock) {
                        if (gen != generation.get() || listener.dropped) {
                            log.debug("Session {} of {} ended before it was established", gen, id);
                            return;
                        }
                        session = s;
                        live = true;
                    }
                    log.info("Connected {} (connection {})", id, gen);
                });
    }

    /**
     * Pulls the oldest buffered event without blocking.
     *
     * @return empty when the session is dead or nothing is buffered
     */
    public Optional<ResolvedEvent> tryDequeue() {
        if (!live) return Optional.empty();

        final Delivered d = waitingEvents.poll();
        if (d == null) return Optional.empty();

        metrics.eventDequeued();
        outstanding.put(d.event().eventId(), d.generation());
        idleSample = metrics.startIdle();
        return Optional.of(d.event());
    }

    /**
     * Marks a dequeued event processed; it is sent to the broker on the next flush.
     *
     * @throws SubscriptionInvariantException if the session is dead
     */
    public void acknowledge(final ResolvedEvent event) {
        final boolean alive;
        boolean current = false;
        synchronized (ackLock) {
            alive = live;
            if (alive) {
                final Long deliveredOn = outstanding.remove(event.eventId());
                current = deliveredOn != null && deliveredOn == generation.get();
                if (current) {
                    toAck.add(event);
                }
            }
        }
        if (!alive) {
            throw fatal("Cannot ACK event " + event.eventId() + ", subscription is dead");
        }

        metrics.eventProcessed();
        final Timer.Sample sample = idleSample;
        if (sample != null) {
            idleSample = null;
            metrics.stopIdle(sample);
        }
        if (!current) {
            log.debug("Skipping ACK of {} on {}: not delivered on the current connection", event.eventId(), id);
        }
    }

    /**
     * Sends all acknowledgements collected since the previous flush.
     *
     * @return number of events in the swapped batch
     * @throws SubscriptionInvariantException if a non-empty batch is due on a dead session
     */
    public int flushAcknowledgements() {
        final List<ResolvedEvent> batch;
        synchronized (ackLock) {
            if (toAck.isEmpty()) return 0;
            batch = toAck;
            toAck = new ArrayList<>();
        }

        final BrokerSession current = session;
        if (!live || current == null) {
            throw fatal("Subscription was stopped while " + batch.size() + " events were waiting to be ACKed");
        }

        log.info("Acknowledging {} events to {}", batch.size(), id);

        final int chunk = config.getAckBatchSize();
        for (int page = 0; page < batch.size(); page += chunk) {
            final List<ResolvedEvent> working = List.copyOf(batch.subList(page, Math.min(page + chunk, batch.size())));
            try {
                current.acknowledge(working);
                metrics.eventsAcknowledged(working.size());
            } catch (final RuntimeException e) {
                // The broker will redeliver what it did not see acknowledged.
                log.warn("Failed to acknowledge {} events to {}", working.size(), id, e);
            }
        }
        return batch.size();
    }

    public int bufferedCount() {
        return waitingEvents.size();
    }

    public int pendingAckCount() {
        synchronized (ackLock) {
            return toAck.size();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        if (live && !failed.get()) {
            flushAcknowledgements();
        }
        acknowledger.cancel(false);

        final BrokerSession current = session;
        if (current != null) {
            current.stop(config.getShutdownGrace());
        }
        live = false;

        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.info("Subscription client {} closed", id);
    }

    private void reconnect() {
        if (closed.get() || cancellation.isCancelled()) return;

        connect().whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Reconnect of {} failed", id, error);
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        if (closed.get() || failed.get() || cancellation.isCancelled()) return;

        metrics.reconnectScheduled();
        scheduler.schedule(this::reconnect, config.getReconnectDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private SubscriptionInvariantException fatal(final String message) {
        failed.set(true);
        live = false;
        acknowledger.cancel(false);

        final SubscriptionInvariantException error = new SubscriptionInvariantException(id, message);
        log.error(ALERT, "ALERT: subscription client {} stopped: {}", id, message);
        try {
            fatalErrorHandler.onFatal(this, error);
        } catch (final RuntimeException e) {
            error.addSuppressed(e);
        }
        return error;
    }

    private record Delivered(ResolvedEvent event, long generation) {
    }

    private final class ConnectionListener implements SubscriptionListener {
        private final long gen;
        private volatile boolean dropped;

        private ConnectionListener(final long gen) {
            this.gen = gen;
        }

        @Override
        public void eventDelivered(final BrokerSession s, final ResolvedEvent e) {
            if (gen != generation.get()) {
                log.debug("Ignoring event {} from severed connection {} of {}", e.eventId(), gen, id);
                return;
            }
            if (cancellation.isCancelled()) {
                log.debug("Subscription cancelled, not buffering event {}", e.eventId());
                return;
            }

            log.debug("Event appeared {} type {} stream [{}] number {} projection event number {}",
                    e.eventId(), e.eventType(), e.streamId(), e.eventNumber(), e.originalEventNumber());
            metrics.eventQueued();
            waitingEvents.add(new Delivered(e, gen));
        }

        @Override
        public void sessionDropped(final BrokerSession s, final DropReason reason, final Throwable error) {
            dropped = true;
            if (gen != generation.get()) {
                log.debug("Ignoring drop of severed connection {} of {}", gen, id);
                return;
            }

            final int pending;
            synchronized (ackLock) {
                live = false;
                outstanding.clear();
                pending = toAck.size();
            }
            log.info("Disconnected {} from subscription. Reason: {}", id, reason, error);
            if (failed.get()) return;

            // Delivered but not processed; the broker sends them again on the next connection.
            int discarded = 0;
            while (waitingEvents.poll() != null) {
                discarded++;
            }
            metrics.eventsDiscarded(discarded);

            if (pending > 0) {
                throw fatal("Subscription dropped and we need to ACK " + pending + " more events");
            }

            if (reason.isUserInitiated() || closed.get()) return;
            if (cancellation.isCancelled()) {
                log.info("Subscription of {} cancelled, not reconnecting", id);
                return;
            }
            scheduleReconnect();
        }
    }
}
