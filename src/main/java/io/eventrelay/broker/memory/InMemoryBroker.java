package io.eventrelay.broker.memory;

import io.eventrelay.broker.BrokerException;
import io.eventrelay.broker.BrokerSession;
import io.eventrelay.broker.DropReason;
import io.eventrelay.broker.PersistentSubscriptionBroker;
import io.eventrelay.broker.SubscriptionListener;
import io.eventrelay.core.model.ResolvedEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process broker with persistent-subscription semantics.
 * <p>
 * Events appended to a stream are pushed round-robin to the live sessions of every
 * group on that stream. An event stays in flight on the session it was pushed to until
 * that session acknowledges it; when the session ends, its unacknowledged events are
 * pushed again to the remaining (or the next) session of the group. A session never has
 * more than its {@code bufferSize} events in flight; the rest wait in the stream until
 * acknowledgements make room.
 * </p>
 *
 * <p>
 * All callbacks run on one delivery thread, so each session sees events in append order.
 * </p>
 */
@Slf4j
public final class InMemoryBroker implements PersistentSubscriptionBroker, AutoCloseable {

    public static final int DEFAULT_MAX_ACK_BATCH = 2000;

    private final String endpoint;
    private final int maxAckBatch;

    private final Map<String, List<ResolvedEvent>> streams = new HashMap<>();
    private final Map<String, GroupState> groups = new HashMap<>();

    private final ExecutorService delivery = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "memory-broker-delivery");
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryBroker(final String endpoint) {
        this(endpoint, DEFAULT_MAX_ACK_BATCH);
    }

    public InMemoryBroker(final String endpoint, final int maxAckBatch) {
        this.endpoint = endpoint;
        this.maxAckBatch = maxAckBatch;
    }

    private static final class GroupState {
        final String stream;
        final List<MemorySession> sessions = new ArrayList<>();
        final Set<UUID> acknowledged = new HashSet<>();
        final Map<UUID, MemorySession> inFlight = new LinkedHashMap<>();
        int cursor;

        GroupState(final String stream) {
            this.stream = stream;
        }

        /* Next session in round-robin order with room for one more event. */
        MemorySession next() {
            for (int tried = 0; tried < sessions.size(); tried++) {
                final MemorySession s = sessions.get(Math.floorMod(cursor++, sessions.size()));
                if (s.pushed < s.bufferSize) return s;
            }
            return null;
        }
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    /**
     * Appends an event to {@code stream} and pushes it to each subscribed group.
     */
    public ResolvedEvent append(final String stream, final String eventType, final byte[] payload) {
        final ResolvedEvent event;
        synchronized (this) {
            ensureOpen();
            final List<ResolvedEvent> log = streams.computeIfAbsent(stream, k -> new ArrayList<>());
            final long number = log.size();
            event = new ResolvedEvent(stream, UUID.randomUUID(), number, number, eventType, payload);
            log.add(event);

            for (final GroupState group : groups.values()) {
                if (group.stream.equals(stream)) {
                    pump(group);
                }
            }
        }
        return event;
    }

    @Override
    public CompletableFuture<BrokerSession> connect(final String stream,
                                                    final String group,
                                                    final int bufferSize,
                                                    final SubscriptionListener listener) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new BrokerException("Broker " + endpoint + " is closed"));
        }

        final CompletableFuture<BrokerSession> future = new CompletableFuture<>();
        delivery.execute(() -> {
            final MemorySession session;
            synchronized (this) {
                final GroupState state = groups.computeIfAbsent(key(stream, group), k -> new GroupState(stream));
                session = new MemorySession(state, group, bufferSize, listener);
                state.sessions.add(session);
                future.complete(session);
                pump(state);
            }
            log.info("Session opened on {}::{} ({} sessions)", stream, group, session.state.sessions.size());
        });
        return future;
    }

    /**
     * Severs every live session of a group as a server-side failure would.
     */
    public void dropSessions(final String stream, final String group, final DropReason reason, final Throwable error) {
        final List<MemorySession> victims;
        synchronized (this) {
            final GroupState state = groups.get(key(stream, group));
            if (state == null) return;
            victims = new ArrayList<>(state.sessions);
        }
        for (final MemorySession s : victims) {
            s.end(reason, error);
        }
    }

    public synchronized int acknowledgedCount(final String stream, final String group) {
        final GroupState state = groups.get(key(stream, group));
        return state == null ? 0 : state.acknowledged.size();
    }

    public synchronized int inFlightCount(final String stream, final String group) {
        final GroupState state = groups.get(key(stream, group));
        return state == null ? 0 : state.inFlight.size();
    }

    public synchronized int sessionCount(final String stream, final String group) {
        final GroupState state = groups.get(key(stream, group));
        return state == null ? 0 : state.sessions.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        delivery.shutdown();
        try {
            if (!delivery.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Delivery thread of {} did not terminate within 5s", endpoint);
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    /* Pushes waiting events of the group, oldest first, while some session has room. Must hold the broker monitor. */
    private void pump(final GroupState state) {
        if (closed.get()) return;

        for (final ResolvedEvent event : streams.getOrDefault(state.stream, List.of())) {
            if (state.acknowledged.contains(event.eventId()) || state.inFlight.containsKey(event.eventId())) {
                continue;
            }
            final MemorySession target = state.next();
            if (target == null) return;

            state.inFlight.put(event.eventId(), target);
            target.pushed++;
            delivery.execute(() -> target.deliver(event));
        }
    }

    private void ensureOpen() {
        if (closed.get()) throw new BrokerException("Broker " + endpoint + " is closed");
    }

    private static String key(final String stream, final String group) {
        return stream + "::" + group;
    }

    /**
     * Session handed to consumers. Records the size of each acknowledged batch.
     */
    public final class MemorySession implements BrokerSession {
        private final GroupState state;
        private final String group;
        private final int bufferSize;
        private final SubscriptionListener listener;
        private final AtomicBoolean ended = new AtomicBoolean(false);
        private final List<Integer> ackBatches = Collections.synchronizedList(new ArrayList<>());

        /* events in flight on this session; guarded by the broker monitor */
        private int pushed;

        private MemorySession(final GroupState state,
                              final String group,
                              final int bufferSize,
                              final SubscriptionListener listener) {
            this.state = state;
            this.group = group;
            this.bufferSize = bufferSize;
            this.listener = listener;
        }

        public List<Integer> ackBatches() {
            synchronized (ackBatches) {
                return List.copyOf(ackBatches);
            }
        }

        @Override
        public void acknowledge(final List<ResolvedEvent> events) {
            if (ended.get()) {
                throw new BrokerException("Session on " + state.stream + "::" + group + " is closed");
            }
            if (events.size() > maxAckBatch) {
                throw new BrokerException("Ack batch of " + events.size() + " exceeds limit " + maxAckBatch);
            }

            synchronized (InMemoryBroker.this) {
                for (final ResolvedEvent e : events) {
                    if (state.inFlight.get(e.eventId()) == this) {
                        state.inFlight.remove(e.eventId());
                        state.acknowledged.add(e.eventId());
                        pushed--;
                    }
                }
                pump(state);
            }
            ackBatches.add(events.size());
        }

        @Override
        public void stop(final Duration timeout) {
            final CompletableFuture<Void> done = new CompletableFuture<>();
            try {
                delivery.execute(() -> {
                    end(DropReason.USER_INITIATED, null);
                    done.complete(null);
                });
            } catch (final RuntimeException e) {
                // delivery thread already gone
                end(DropReason.USER_INITIATED, null);
                return;
            }

            try {
                done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (final InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (final ExecutionException | TimeoutException e) {
                log.warn("Session on {}::{} did not stop within {}", state.stream, group, timeout, e);
            }
        }

        private void deliver(final ResolvedEvent event) {
            if (ended.get()) return;
            try {
                listener.eventDelivered(this, event);
            } catch (final RuntimeException e) {
                log.error("Subscriber failed on delivery of {}", event.eventId(), e);
            }
        }

        private void end(final DropReason reason, final Throwable error) {
            if (!ended.compareAndSet(false, true)) return;

            synchronized (InMemoryBroker.this) {
                state.sessions.remove(this);
                final List<UUID> orphaned = new ArrayList<>();
                state.inFlight.forEach((id, owner) -> {
                    if (owner == this) orphaned.add(id);
                });
                orphaned.forEach(state.inFlight::remove);
                pushed = 0;
                pump(state);
            }

            log.info("Session on {}::{} dropped: {}", state.stream, group, reason);
            try {
                listener.sessionDropped(this, reason, error);
            } catch (final RuntimeException e) {
                log.error("Subscriber failed while handling drop of {}::{}", state.stream, group, e);
            }
        }
    }
}
