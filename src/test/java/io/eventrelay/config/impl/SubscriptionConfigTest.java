package io.eventrelay.config.impl;

import io.eventrelay.config.type.ConfigLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SubscriptionConfigTest {

    @TempDir
    Path dir;

    private Path write(final String yaml) throws Exception {
        final Path file = dir.resolve("subscription.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void missingKeysFallBackToDefaults() throws Exception {
        final Path file = write("stream: $ce-orders\ngroup: billing\n");

        final SubscriptionConfig config = ConfigLoader.load(file.toString());

        assertEquals("$ce-orders", config.getStream());
        assertEquals("billing", config.getGroup());
        assertEquals(1, config.getShards());
        assertEquals(100, config.getReadSize());
        assertEquals(2000, config.getAckBatchSize());
        assertEquals(100, config.getRetryBatchSize());
        assertEquals(Duration.ofSeconds(5), config.getFlushInterval());
        assertEquals(Duration.ofSeconds(30), config.getShutdownGrace());
        assertEquals(Duration.ofSeconds(1), config.getReconnectDelay());
        assertEquals(Duration.ofMillis(10), config.getPollInterval());
        assertEquals(Duration.ofSeconds(1), config.getRetryInterval());
        assertEquals("$ce-orders.retry", config.getRetryChannel());
    }

    @Test
    void everyKeyIsRead() throws Exception {
        final Path file = write(String.join("\n",
                "stream: $ce-orders",
                "group: billing",
                "shards: 4",
                "readSize: 50",
                "ackBatchSize: 500",
                "retryBatchSize: 20",
                "flushIntervalMs: 250",
                "shutdownGraceMs: 0",
                "reconnectDelayMs: 1500",
                "pollIntervalMs: 2",
                "retryIntervalMs: 3000",
                "retryChannel: billing-retries",
                ""));

        final SubscriptionConfig config = SubscriptionConfig.load(file.toString());

        assertEquals(4, config.getShards());
        assertEquals(50, config.getReadSize());
        assertEquals(500, config.getAckBatchSize());
        assertEquals(20, config.getRetryBatchSize());
        assertEquals(Duration.ofMillis(250), config.getFlushInterval());
        assertEquals(Duration.ZERO, config.getShutdownGrace());
        assertEquals(Duration.ofMillis(1500), config.getReconnectDelay());
        assertEquals(Duration.ofMillis(2), config.getPollInterval());
        assertEquals(Duration.ofSeconds(3), config.getRetryInterval());
        assertEquals("billing-retries", config.getRetryChannel());
    }

    @Test
    void streamAndGroupAreRequired() throws Exception {
        final IllegalArgumentException noGroup = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.load(write("stream: orders\n").toString()));
        assertTrue(noGroup.getMessage().contains("group"));

        final IllegalArgumentException noStream = assertThrows(IllegalArgumentException.class,
                () -> SubscriptionConfig.builder().group("billing").build().validate());
        assertTrue(noStream.getMessage().contains("stream"));
    }

    @Test
    void emptyFileIsRejected() throws Exception {
        final Path file = write("");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(file.toString()));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        final SubscriptionConfig base = SubscriptionConfig.builder().stream("orders").group("billing").build();

        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().shards(0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> base.toBuilder().ackBatchSize(-1).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().flushInterval(Duration.ZERO).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().reconnectDelay(Duration.ofMillis(-1)).build().validate());

        // zero delay means reconnect at once
        base.toBuilder().reconnectDelay(Duration.ZERO).build().validate();
    }

    @Test
    void unsetDurationsAreRejectedAsInvalidSettings() {
        final SubscriptionConfig base = SubscriptionConfig.builder().stream("orders").group("billing").build();

        final IllegalArgumentException grace = assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().shutdownGrace(null).build().validate());
        assertTrue(grace.getMessage().contains("shutdownGrace"));

        final IllegalArgumentException delay = assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().reconnectDelay(null).build().validate());
        assertTrue(delay.getMessage().contains("reconnectDelay"));
    }
}
