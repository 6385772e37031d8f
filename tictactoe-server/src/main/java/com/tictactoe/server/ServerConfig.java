package com.tictactoe.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Server settings.
 *
 * Resolution order, later wins:
 * 1. tictactoe.properties on the classpath
 * 2. JVM system properties with the same keys
 * 3. PORT environment variable (port only)
 * 4. First command-line argument (port only), applied in Main
 */
public final class ServerConfig {

    static final String RESOURCE = "tictactoe.properties";

    static final String PORT = "server.port";
    static final String PATH = "server.path";
    static final String MAX_FRAME_SIZE = "server.maxFrameSize";
    static final String IDLE_TIMEOUT = "connection.idleTimeoutSeconds";
    static final String STALENESS = "reaper.stalenessSeconds";
    static final String REAPER_INTERVAL = "reaper.intervalSeconds";

    private final int port;
    private final String path;
    private final int maxFrameSize;
    private final Duration idleTimeout;
    private final Duration staleness;
    private final Duration reaperInterval;

    private ServerConfig(Builder builder) {
        this.port = builder.port;
        this.path = builder.path;
        this.maxFrameSize = builder.maxFrameSize;
        this.idleTimeout = builder.idleTimeout;
        this.staleness = builder.staleness;
        this.reaperInterval = builder.reaperInterval;
    }

    /**
     * Loads settings from the classpath, system properties and environment.
     */
    public static ServerConfig load() {
        return load(System.getProperties(), System.getenv());
    }

    public static ServerConfig load(Properties overrides, Map<String, String> env) {
        Properties props = new Properties();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : overrides.stringPropertyNames()) {
            props.setProperty(key, overrides.getProperty(key));
        }
        String envPort = env.get("PORT");
        if (envPort != null && !envPort.isBlank()) {
            props.setProperty(PORT, envPort.trim());
        }

        Builder builder = builder();
        if (props.containsKey(PORT)) {
            builder.port(intValue(props, PORT));
        }
        if (props.containsKey(PATH)) {
            builder.path(props.getProperty(PATH).trim());
        }
        if (props.containsKey(MAX_FRAME_SIZE)) {
            builder.maxFrameSize(intValue(props, MAX_FRAME_SIZE));
        }
        if (props.containsKey(IDLE_TIMEOUT)) {
            builder.idleTimeout(Duration.ofSeconds(intValue(props, IDLE_TIMEOUT)));
        }
        if (props.containsKey(STALENESS)) {
            builder.staleness(Duration.ofSeconds(intValue(props, STALENESS)));
        }
        if (props.containsKey(REAPER_INTERVAL)) {
            builder.reaperInterval(Duration.ofSeconds(intValue(props, REAPER_INTERVAL)));
        }
        return builder.build();
    }

    private static int intValue(Properties props, String key) {
        String raw = props.getProperty(key).trim();
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "'", e);
        }
    }

    /**
     * Copy of this config listening on another port.
     */
    public ServerConfig withPort(int newPort) {
        return toBuilder().port(newPort).build();
    }

    public Builder toBuilder() {
        return builder()
                .port(port)
                .path(path)
                .maxFrameSize(maxFrameSize)
                .idleTimeout(idleTimeout)
                .staleness(staleness)
                .reaperInterval(reaperInterval);
    }

    public int getPort() {
        return port;
    }

    public String getPath() {
        return path;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public Duration getStaleness() {
        return staleness;
    }

    public Duration getReaperInterval() {
        return reaperInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int port = 8080;
        private String path = "/ws";
        private int maxFrameSize = 65536;
        private Duration idleTimeout = Duration.ofSeconds(60);
        private Duration staleness = Duration.ofMinutes(20);
        private Duration reaperInterval = Duration.ofMinutes(10);

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder maxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder staleness(Duration staleness) {
            this.staleness = staleness;
            return this;
        }

        public Builder reaperInterval(Duration reaperInterval) {
            this.reaperInterval = reaperInterval;
            return this;
        }

        public ServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            if (path == null || !path.startsWith("/")) {
                throw new IllegalArgumentException("WebSocket path must start with '/': " + path);
            }
            if (maxFrameSize <= 0) {
                throw new IllegalArgumentException("Max frame size must be positive: " + maxFrameSize);
            }
            requirePositive(idleTimeout, IDLE_TIMEOUT);
            requirePositive(staleness, STALENESS);
            requirePositive(reaperInterval, REAPER_INTERVAL);
            return new ServerConfig(this);
        }

        private static void requirePositive(Duration value, String key) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(key + " must be positive: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "port=" + port +
                ", path='" + path + '\'' +
                ", idleTimeout=" + idleTimeout.toSeconds() + "s" +
                ", staleness=" + staleness.toSeconds() + "s" +
                ", reaperInterval=" + reaperInterval.toSeconds() + "s" +
                '}';
    }
}
