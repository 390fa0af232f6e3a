package io.eventrelay.broker.memory;

import io.eventrelay.broker.BrokerException;
import io.eventrelay.broker.BrokerSession;
import io.eventrelay.broker.DropReason;
import io.eventrelay.broker.SubscriptionListener;
import io.eventrelay.core.model.ResolvedEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class InMemoryBrokerTest {

    private static final String STREAM = "orders";
    private static final String GROUP = "billing";

    /* Collects callbacks for the test thread. */
    private static final class Recorder implements SubscriptionListener {
        final BlockingQueue<ResolvedEvent> events = new LinkedBlockingQueue<>();
        final BlockingQueue<DropReason> drops = new LinkedBlockingQueue<>();

        @Override
        public void eventDelivered(final BrokerSession session, final ResolvedEvent event) {
            events.add(event);
        }

        @Override
        public void sessionDropped(final BrokerSession session, final DropReason reason, final Throwable error) {
            drops.add(reason);
        }

        ResolvedEvent next() throws InterruptedException {
            final ResolvedEvent e = events.poll(5, TimeUnit.SECONDS);
            assertNotNull(e, "no event delivered");
            return e;
        }
    }

    private static byte[] bytes(final String s) {
        return s.getBytes();
    }

    @Test
    void appendsAreNumberedAndPushedInOrder() throws Exception {
        try (InMemoryBroker broker = new InMemoryBroker("mem")) {
            final Recorder recorder = new Recorder();
            broker.connect(STREAM, GROUP, 10, recorder).get(5, TimeUnit.SECONDS);

            broker.append(STREAM, "OrderPlaced", bytes("a"));
            broker.append(STREAM, "OrderPaid", bytes("b"));

            final ResolvedEvent first = recorder.next();
            final ResolvedEvent second = recorder.next();
            assertEquals(0, first.eventNumber());
            assertEquals("OrderPlaced", first.eventType());
            assertEquals(1, second.eventNumber());
            assertEquals(STREAM, second.streamId());
        }
    }

    @Test
    void eventsAppendedBeforeConnectAreDelivered() throws Exception {
        try (InMemoryBroker broker = new InMemoryBroker("mem")) {
            broker.append(STREAM, "OrderPlaced", bytes("a"));
            broker.append(STREAM, "OrderPlaced", bytes("b"));

            final Recorder recorder = new Recorder();
            broker.connect(STREAM, GROUP, 10, recorder).get(5, TimeUnit.SECONDS);

            assertEquals(0, recorder.next().eventNumber());
            assertEquals(1, recorder.next().eventNumber());
            assertEquals(2, broker.inFlightCount(STREAM, GROUP));
        }
    }

    @Test
    void acknowledgedEventsAreNotRedelivered() throws Exception {
        try (InMemoryBroker broker = new InMemoryBroker("mem")) {
            final Recorder first = new Recorder();
            final BrokerSession session = broker.connect(STREAM, GROUP, 10, first).get(5, TimeUnit.SECONDS);
            broker.append(STREAM, "OrderPlaced", bytes("a"));
            broker.append(STREAM, "OrderPlaced", bytes("b"));

            final ResolvedEvent acked = first.next();
            final ResolvedEvent unacked = first.next();
            session.acknowledge(List.of(acked));
            assertEquals(1, broker.acknowledgedCount(STREAM, GROUP));
            assertEquals(List.of(1), ((InMemoryBroker.MemorySession) session).ackBatches());

            session.stop(Duration.ofSeconds(5));
            assertEquals(DropReason.USER_INITIATED, first.drops.poll(5, TimeUnit.SECONDS));

            final Recorder second = new Recorder();
            broker.connect(STREAM, GROUP, 10, second).get(5, TimeUnit.SECONDS);

            assertEquals(unacked.eventId(), second.next().eventId());
            assertNull(second.events.poll(100, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void droppedSessionsEventsMoveToTheRemainingSession() throws Exception {
        try (InMemoryBroker broker = new InMemoryBroker("mem")) {
            final Recorder a = new Recorder();
            final Recorder b = new Recorder();
            final InMemoryBroker.MemorySession sessionA =
                    (InMemoryBroker.MemorySession) broker.connect(STREAM, GROUP, 10, a).get(5, TimeUnit.SECONDS);
            broker.connect(STREAM, GROUP, 10, b).get(5, TimeUnit.SECONDS);
            assertEquals(2, broker.sessionCount(STREAM, GROUP));

            for (int i = 0; i < 4; i++) {
                broker.append(STREAM, "OrderPlaced", bytes("e" + i));
            }

            // round robin across the two sessions
            final List<Long> seenByA = new ArrayList<>();
            seenByA.add(a.next().eventNumber());
            seenByA.add(a.next().eventNumber());
            b.next();
            b.next();
            assertEquals(List.of(0L, 2L), seenByA);

            sessionA.stop(Duration.ofSeconds(5));
            assertEquals(1, broker.sessionCount(STREAM, GROUP));

            final List<Long> redelivered = List.of(b.next().eventNumber(), b.next().eventNumber());
            assertEquals(List.of(0L, 2L), redelivered);
        }
    }

    @Test
    void serverSideDropIsReportedWithItsReason() throws Exception {
        try (InMemoryBroker broker = new InMemoryBroker("mem")) {
            final Recorder recorder = new Recorder();
            broker.connect(STREAM, GROUP, 10, recorder).get(5, TimeUnit.SECONDS);

            broker.dropSessions(STREAM, GROUP, DropReason.SERVER_ERROR, new RuntimeException("node lost"));

            assertEquals(DropReason.SERVER_ERROR, recorder.drops.poll(5, TimeUnit.SECONDS));
            assertEquals(0, broker.sessionCount(STREAM, GROUP));
        }
    }

    @Test
    void sessionNeverHoldsMoreThanItsBufferSize() throws Exception {
        try (InMemoryBroker broker = new InMemoryBroker("mem")) {
            final Recorder recorder = new Recorder();
            final BrokerSession session = broker.connect(STREAM, GROUP, 2, recorder).get(5, TimeUnit.SECONDS);
            for (int i = 0; i < 5; i++) {
                broker.append(STREAM, "OrderPlaced", bytes("e" + i));
            }

            final ResolvedEvent e0 = recorder.next();
            final ResolvedEvent e1 = recorder.next();
            assertNull(recorder.events.poll(100, TimeUnit.MILLISECONDS));
            assertEquals(2, broker.inFlightCount(STREAM, GROUP));

            session.acknowledge(List.of(e0));
            assertEquals(2, recorder.next().eventNumber());
            assertNull(recorder.events.poll(100, TimeUnit.MILLISECONDS));

            session.acknowledge(List.of(e1));
            assertEquals(3, recorder.next().eventNumber());
            assertEquals(List.of(1, 1), ((InMemoryBroker.MemorySession) session).ackBatches());
        }
    }

    @Test
    void oversizedOrLateAcknowledgementsAreRejected() throws Exception {
        try (InMemoryBroker broker = new InMemoryBroker("mem", 1)) {
            final Recorder recorder = new Recorder();
            final InMemoryBroker.MemorySession session =
                    (InMemoryBroker.MemorySession) broker.connect(STREAM, GROUP, 10, recorder).get(5, TimeUnit.SECONDS);
            broker.append(STREAM, "OrderPlaced", bytes("a"));
            broker.append(STREAM, "OrderPlaced", bytes("b"));
            final List<ResolvedEvent> both = List.of(recorder.next(), recorder.next());

            assertThrows(BrokerException.class, () -> session.acknowledge(both));
            assertEquals(List.of(), session.ackBatches());
            session.acknowledge(both.subList(0, 1));
            assertEquals(List.of(1), session.ackBatches());

            session.stop(Duration.ofSeconds(5));
            assertThrows(BrokerException.class, () -> session.acknowledge(both.subList(0, 1)));
        }
    }

    @Test
    void closedBrokerRefusesConnections() {
        final InMemoryBroker broker = new InMemoryBroker("mem");
        broker.close();

        assertTrue(broker.connect(STREAM, GROUP, 10, new Recorder()).isCompletedExceptionally());
        assertThrows(BrokerException.class, () -> broker.append(STREAM, "OrderPlaced", bytes("a")));
    }
}
