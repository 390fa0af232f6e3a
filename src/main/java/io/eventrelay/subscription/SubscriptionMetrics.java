package io.eventrelay.subscription;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Meters of one subscription client, tagged with its id.
 * <p>
 * eventrelay.client.queued: delivered events not yet dequeued
 * eventrelay.client.processed: events handed back for acknowledgement
 * eventrelay.client.acknowledged: events acknowledged to the broker
 * eventrelay.client.reconnects: reconnects scheduled after a drop
 * eventrelay.client.idle: time between a dequeue and its acknowledgement
 * eventrelay.queued: queued events across all clients of the process
 */
public final class SubscriptionMetrics {

    private static final AtomicLong QUEUED_EVENTS = new AtomicLong();

    private final MeterRegistry registry;
    private final AtomicLong queued = new AtomicLong();
    private final Counter processed;
    private final Counter acknowledged;
    private final Counter reconnects;
    private final Timer idle;

    public SubscriptionMetrics(final MeterRegistry registry, final String clientId) {
        this.registry = registry;

        Gauge.builder("eventrelay.queued", QUEUED_EVENTS, AtomicLong::get)
                .description("Queued events across all subscription clients")
                .register(registry);
        Gauge.builder("eventrelay.client.queued", queued, AtomicLong::get)
                .description("Delivered events waiting to be dequeued")
                .tag("client", clientId)
                .register(registry);

        this.processed = Counter.builder("eventrelay.client.processed")
                .description("Events marked processed")
                .tag("client", clientId)
                .register(registry);
        this.acknowledged = Counter.builder("eventrelay.client.acknowledged")
                .description("Events acknowledged to the broker")
                .tag("client", clientId)
                .register(registry);
        this.reconnects = Counter.builder("eventrelay.client.reconnects")
                .description("Reconnects scheduled after a dropped session")
                .tag("client", clientId)
                .register(registry);
        this.idle = Timer.builder("eventrelay.client.idle")
                .description("Time from dequeue to acknowledgement")
                .tag("client", clientId)
                .register(registry);
    }

    void eventQueued() {
        queued.incrementAndGet();
        QUEUED_EVENTS.incrementAndGet();
    }

    void eventDequeued() {
        eventsDiscarded(1);
    }

    void eventsDiscarded(final int count) {
        queued.addAndGet(-count);
        QUEUED_EVENTS.addAndGet(-count);
    }

    void eventProcessed() {
        processed.increment();
    }

    void eventsAcknowledged(final int count) {
        acknowledged.increment(count);
    }

    void reconnectScheduled() {
        reconnects.increment();
    }

    Timer.Sample startIdle() {
        return Timer.start(registry);
    }

    void stopIdle(final Timer.Sample sample) {
        sample.stop(idle);
    }

    public long queued() {
        return queued.get();
    }

    public long processed() {
        return (long) processed.count();
    }

    public long acknowledged() {
        return (long) acknowledged.count();
    }

    public long reconnects() {
        return (long) reconnects.count();
    }

    public long idleCount() {
        return idle.count();
    }
}
