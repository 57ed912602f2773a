/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.config;

import java.util.Properties;

/**
 * Startup-time configuration of the relay.
 * Loaded once from application.properties and never mutated afterwards.
 */
public class RelaySettings {

    public static final String KEY_VERSION = "server.version";
    public static final String KEY_PORT = "server.port";
    public static final String KEY_BIND_ADDRESS = "bind.address";
    public static final String KEY_HEARTBEAT_ENABLED = "heartbeat.enabled";
    public static final String KEY_HEARTBEAT_INTERVAL_MS = "heartbeat.interval.ms";
    public static final String KEY_HEARTBEAT_TIMEOUT_MS = "heartbeat.timeout.ms";
    public static final String KEY_MAX_PENDING = "max.pending";
    public static final String KEY_VERBOSE = "verbose";

    private final String version;
    private final int port;
    private final String bindAddress;
    private final boolean heartbeatEnabled;
    private final long heartbeatIntervalMs;
    private final long heartbeatTimeoutMs;
    private final int maxPending;
    private final boolean verbose;

    private RelaySettings(Builder builder) {
        this.version = builder.version;
        this.port = builder.port;
        this.bindAddress = builder.bindAddress;
        this.heartbeatEnabled = builder.heartbeatEnabled;
        this.heartbeatIntervalMs = builder.heartbeatIntervalMs;
        this.heartbeatTimeoutMs = builder.heartbeatTimeoutMs;
        this.maxPending = builder.maxPending;
        this.verbose = builder.verbose;
    }

    /**
     * Reads settings from properties, falling back to the built-in defaults
     * for missing keys.
     *
     * @throws IllegalArgumentException if a value is malformed or the combination is invalid
     */
    public static RelaySettings fromProperties(Properties props) {
        Builder b = builder();
        b.version(props.getProperty(KEY_VERSION, b.version).trim());
        b.port(parseInt(props, KEY_PORT, b.port));
        b.bindAddress(props.getProperty(KEY_BIND_ADDRESS, b.bindAddress).trim());
        b.heartbeatEnabled(Boolean.parseBoolean(
                props.getProperty(KEY_HEARTBEAT_ENABLED, String.valueOf(b.heartbeatEnabled)).trim()));
        b.heartbeatIntervalMs(parseLong(props, KEY_HEARTBEAT_INTERVAL_MS, b.heartbeatIntervalMs));
        b.heartbeatTimeoutMs(parseLong(props, KEY_HEARTBEAT_TIMEOUT_MS, b.heartbeatTimeoutMs));
        b.maxPending(parseInt(props, KEY_MAX_PENDING, b.maxPending));
        b.verbose(Boolean.parseBoolean(props.getProperty(KEY_VERBOSE, String.valueOf(b.verbose)).trim()));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + raw + "'", e);
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": '" + raw + "'", e);
        }
    }

    public String getVersion() {
        return version;
    }

    public int getPort() {
        return port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public boolean isHeartbeatEnabled() {
        return heartbeatEnabled;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public long getHeartbeatTimeoutMs() {
        return heartbeatTimeoutMs;
    }

    public int getMaxPending() {
        return maxPending;
    }

    public boolean isVerbose() {
        return verbose;
    }

    @Override
    public String toString() {
        return "RelaySettings{" +
                "version='" + version + '\'' +
                ", bind=" + bindAddress + ":" + port +
                ", heartbeat=" + (heartbeatEnabled
                        ? heartbeatIntervalMs + "ms/" + heartbeatTimeoutMs + "ms"
                        : "off") +
                ", maxPending=" + maxPending +
                ", verbose=" + verbose +
                '}';
    }

    public static class Builder {
        private String version = "1.4";
        private int port = 1337;
        private String bindAddress = "127.0.0.1";
        private boolean heartbeatEnabled = true;
        private long heartbeatIntervalMs = 10_000;
        private long heartbeatTimeoutMs = 3_000;
        private int maxPending = 1024;
        private boolean verbose = false;

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder bindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder heartbeatEnabled(boolean heartbeatEnabled) {
            this.heartbeatEnabled = heartbeatEnabled;
            return this;
        }

        public Builder heartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
            return this;
        }

        public Builder heartbeatTimeoutMs(long heartbeatTimeoutMs) {
            this.heartbeatTimeoutMs = heartbeatTimeoutMs;
            return this;
        }

        public Builder maxPending(int maxPending) {
            this.maxPending = maxPending;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public RelaySettings build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            if (bindAddress == null || bindAddress.isEmpty()) {
                throw new IllegalArgumentException("Bind address must not be empty");
            }
            if (maxPending <= 0) {
                throw new IllegalArgumentException("max.pending must be positive: " + maxPending);
            }
            if (heartbeatIntervalMs <= 0 || heartbeatTimeoutMs <= 0) {
                throw new IllegalArgumentException("Heartbeat durations must be positive");
            }
            // A deadline must expire before the next PING is due.
            if (heartbeatEnabled && heartbeatIntervalMs <= heartbeatTimeoutMs) {
                throw new IllegalArgumentException(String.format(
                        "heartbeat.interval.ms (%d) must be greater than heartbeat.timeout.ms (%d)",
                        heartbeatIntervalMs, heartbeatTimeoutMs));
            }
            return new RelaySettings(this);
        }
    }
}
