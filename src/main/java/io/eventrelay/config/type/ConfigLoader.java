package io.eventrelay.config.type;

import io.eventrelay.config.impl.SubscriptionConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads subscription configuration from a YAML file by delegating to {@link SubscriptionConfig#load(String)}.
     * <p>
     * The YAML file is expected to have the following structure:
     * <pre>
     * stream: $ce-orders
     * group: order-handlers
     * shards: 2
     * flushIntervalMs: 5000
     * ackBatchSize: 2000
     * </pre>
     * Keys left out fall back to the defaults of {@link SubscriptionConfig.SubscriptionConfigBuilder}.
     *
     * @param path the path to the subscription YAML configuration file
     * @return a validated {@link SubscriptionConfig} instance
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if a required key is missing or a value is out of range
     */
    public static SubscriptionConfig load(final String path) throws IOException {
        return SubscriptionConfig.load(path);
    }
}
