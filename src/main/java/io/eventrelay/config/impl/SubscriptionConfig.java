package io.eventrelay.config.impl;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable subscription settings loaded from subscription.yaml
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SubscriptionConfig {

    private final String stream;
    private final String group;

    @Builder.Default private final int shards = 1;
    @Builder.Default private final int readSize = 100;
    @Builder.Default private final int ackBatchSize = 2000;
    @Builder.Default private final int retryBatchSize = 100;

    @Builder.Default private final Duration flushInterval = Duration.ofSeconds(5);
    @Builder.Default private final Duration shutdownGrace = Duration.ofSeconds(30);
    @Builder.Default private final Duration reconnectDelay = Duration.ofSeconds(1);
    @Builder.Default private final Duration pollInterval = Duration.ofMillis(10);
    @Builder.Default private final Duration retryInterval = Duration.ofSeconds(1);

    /* null means "<stream>.retry" */
    private final String retryChannel;

    public String getRetryChannel() {
        return retryChannel != null ? retryChannel : stream + ".retry";
    }

    /**
     * Checks required keys and bounds.
     *
     * @return this instance
     * @throws IllegalArgumentException when a value is missing or out of range
     */
    public SubscriptionConfig validate() {
        require(stream, "stream");
        require(group, "group");
        positive(shards, "shards");
        positive(readSize, "readSize");
        positive(ackBatchSize, "ackBatchSize");
        positive(retryBatchSize, "retryBatchSize");
        positive(flushInterval, "flushInterval");
        positive(pollInterval, "pollInterval");
        positive(retryInterval, "retryInterval");
        nonNegative(shutdownGrace, "shutdownGrace");
        nonNegative(reconnectDelay, "reconnectDelay");
        return this;
    }

    public static SubscriptionConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) {
                throw new IllegalArgumentException("Empty subscription config: " + path);
            }
            final SubscriptionConfig defaults = builder().build();

            return builder()
                    .stream((String) m.get("stream"))
                    .group((String) m.get("group"))
                    .shards((Integer) m.getOrDefault("shards", defaults.shards))
                    .readSize((Integer) m.getOrDefault("readSize", defaults.readSize))
                    .ackBatchSize((Integer) m.getOrDefault("ackBatchSize", defaults.ackBatchSize))
                    .retryBatchSize((Integer) m.getOrDefault("retryBatchSize", defaults.retryBatchSize))
                    .flushInterval(millis(m, "flushIntervalMs", defaults.flushInterval))
                    .shutdownGrace(millis(m, "shutdownGraceMs", defaults.shutdownGrace))
                    .reconnectDelay(millis(m, "reconnectDelayMs", defaults.reconnectDelay))
                    .pollInterval(millis(m, "pollIntervalMs", defaults.pollInterval))
                    .retryInterval(millis(m, "retryIntervalMs", defaults.retryInterval))
                    .retryChannel((String) m.get("retryChannel"))
                    .build()
                    .validate();
        }
    }

    private static Duration millis(final Map<String, Object> m, final String key, final Duration fallback) {
        final Object v = m.get(key);
        return v == null ? fallback : Duration.ofMillis(((Number) v).longValue());
    }

    private static void require(final String value, final String key) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required setting '" + key + "'");
        }
    }

    private static void positive(final int value, final String key) {
        if (value < 1) {
            throw new IllegalArgumentException("'" + key + "' must be positive, was " + value);
        }
    }

    private static void positive(final Duration value, final String key) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("'" + key + "' must be positive, was " + value);
        }
    }

    private static void nonNegative(final Duration value, final String key) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException("'" + key + "' must not be negative, was " + value);
        }
    }

    @Override
    public String toString() {
        return "SubscriptionConfig{stream='" + stream + "', group='" + group
                + "', shards=" + shards + ", readSize=" + readSize + ", ackBatchSize=" + ackBatchSize
                + ", flushInterval=" + flushInterval + "}";
    }
}
