/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay;

import com.chatrelay.config.RelaySettings;
import com.chatrelay.server.ChatRelayServer;
import com.chatrelay.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Launcher for the chat relay.
 *
 * Loads configuration, starts the server and blocks until the JVM is asked to
 * stop (Ctrl-C / SIGTERM), at which point the server is shut down cleanly.
 */
public class ChatRelayApplication {

    private static final String CONFIG_RESOURCE = "application.properties";

    private static ChatRelayServer server;
    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        try {
            Properties config = loadConfiguration();
            RelaySettings settings = RelaySettings.fromProperties(config);
            LoggerUtil.setDebugEnabled(settings.isVerbose());

            LoggerUtil.info("Starting server version " + settings.getVersion() + " on port " + settings.getPort());
            LoggerUtil.info("Effective settings: " + settings);

            server = new ChatRelayServer(settings);
            server.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LoggerUtil.info("Shutting down chat relay...");
                shutdown();
            }, "Shutdown-Hook"));

            LoggerUtil.info("Press Ctrl-C to quit the server");
            shutdownLatch.await();

        } catch (Exception e) {
            LoggerUtil.error("Failed to start chat relay", e);
            shutdown();
            System.exit(1);
        }
    }

    /**
     * Loads configuration in three layers, later ones overriding earlier ones:
     * classpath application.properties, an optional external
     * resources/application.properties, and JVM system properties with the same keys.
     */
    static Properties loadConfiguration() throws IOException {
        Properties config = new Properties();

        try (InputStream inputStream = ChatRelayApplication.class.getClassLoader()
                .getResourceAsStream(CONFIG_RESOURCE)) {
            if (inputStream == null) {
                LoggerUtil.warn(CONFIG_RESOURCE + " not found in classpath, using built-in defaults");
            } else {
                config.load(inputStream);
            }
        }

        Path externalConfigPath = Paths.get("resources", CONFIG_RESOURCE);
        if (Files.exists(externalConfigPath)) {
            LoggerUtil.info("Loading configuration overrides from " + externalConfigPath.toAbsolutePath());
            try (InputStream inputStream = Files.newInputStream(externalConfigPath)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);
            } catch (IOException e) {
                LoggerUtil.warn("Failed to load external configuration overrides: " + e.getMessage());
            }
        }

        applySystemOverrides(config, System.getProperties());
        return config;
    }

    static void applySystemOverrides(Properties config, Properties system) {
        for (String key : new String[] {
                RelaySettings.KEY_VERSION,
                RelaySettings.KEY_PORT,
                RelaySettings.KEY_BIND_ADDRESS,
                RelaySettings.KEY_HEARTBEAT_ENABLED,
                RelaySettings.KEY_HEARTBEAT_INTERVAL_MS,
                RelaySettings.KEY_HEARTBEAT_TIMEOUT_MS,
                RelaySettings.KEY_MAX_PENDING,
                RelaySettings.KEY_VERBOSE}) {
            String value = system.getProperty(key);
            if (value != null) {
                config.setProperty(key, value);
            }
        }
    }

    private static void shutdown() {
        try {
            if (server != null) {
                LoggerUtil.info("Stopping server...");
                server.stop();
            }
            LoggerUtil.info("Chat relay shutdown complete");
        } finally {
            shutdownLatch.countDown();
        }
    }
}
