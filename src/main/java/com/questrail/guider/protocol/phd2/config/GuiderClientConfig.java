package com.questrail.guider.protocol.phd2.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for a guider client and the process it may start.
 *
 * <p>Defaults: {@code localhost:4400}, 10 s connection timeout, 30 s call
 * timeout, reconnect enabled every 5 s without bound, subscriber queues of
 * 100 events, 1 MiB maximum line length, no auto start.</p>
 */
public record GuiderClientConfig(
        String host,
        int port,
        Duration connectionTimeout,
        Duration callTimeout,
        Optional<Path> executablePath,
        boolean autoStart,
        Map<String, String> spawnEnvironment,
        ReconnectPolicy reconnect,
        int subscriberQueueCapacity,
        int maxFrameLength
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 4400;

    public GuiderClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(executablePath, "executablePath");
        Objects.requireNonNull(spawnEnvironment, "spawnEnvironment");
        Objects.requireNonNull(reconnect, "reconnect");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (connectionTimeout.isNegative() || connectionTimeout.isZero()) {
            throw new IllegalArgumentException("connectionTimeout must be positive");
        }
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        if (subscriberQueueCapacity < 1) {
            throw new IllegalArgumentException("subscriberQueueCapacity must be >= 1");
        }
        if (maxFrameLength < 64) {
            throw new IllegalArgumentException("maxFrameLength must be >= 64");
        }

        spawnEnvironment = Map.copyOf(spawnEnvironment);
    }

    public static GuiderClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withHost(host)
                .withPort(port)
                .withConnectionTimeout(connectionTimeout)
                .withCallTimeout(callTimeout)
                .withExecutablePath(executablePath.orElse(null))
                .withAutoStart(autoStart)
                .withSpawnEnvironment(spawnEnvironment)
                .withReconnect(reconnect)
                .withSubscriberQueueCapacity(subscriberQueueCapacity)
                .withMaxFrameLength(maxFrameLength);
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private Duration callTimeout = Duration.ofSeconds(30);
        private Path executablePath;
        private boolean autoStart = false;
        private Map<String, String> spawnEnvironment = Map.of();
        private ReconnectPolicy reconnect = ReconnectPolicy.defaults();
        private int subscriberQueueCapacity = 100;
        private int maxFrameLength = 1024 * 1024;

        private Builder() {}

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder withCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        /** Explicit controller executable; {@code null} means platform lookup. */
        public Builder withExecutablePath(Path executablePath) {
            this.executablePath = executablePath;
            return this;
        }

        public Builder withAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
            return this;
        }

        /** Extra environment variables for the spawned controller, e.g. {@code DISPLAY}. */
        public Builder withSpawnEnvironment(Map<String, String> spawnEnvironment) {
            this.spawnEnvironment = spawnEnvironment;
            return this;
        }

        public Builder withReconnect(ReconnectPolicy reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        public Builder withSubscriberQueueCapacity(int subscriberQueueCapacity) {
            this.subscriberQueueCapacity = subscriberQueueCapacity;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public GuiderClientConfig build() {
            return new GuiderClientConfig(
                    host,
                    port,
                    connectionTimeout,
                    callTimeout,
                    Optional.ofNullable(executablePath),
                    autoStart,
                    spawnEnvironment,
                    reconnect,
                    subscriberQueueCapacity,
                    maxFrameLength);
        }
    }
}
