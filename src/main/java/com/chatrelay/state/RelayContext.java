/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.state;

import com.chatrelay.auth.UserRegistry;
import com.chatrelay.config.RelaySettings;
import com.chatrelay.utils.LoggerUtil;

/**
 * Process-wide state handed to every connection handler.
 * Built once by the server; handlers never create their own.
 */
public final class RelayContext {

    private final RelaySettings settings;
    private final UserRegistry userRegistry;
    private final ConnectionSet connections;

    public RelayContext(RelaySettings settings) {
        this(settings, new UserRegistry(), new ConnectionSet());
    }

    public RelayContext(RelaySettings settings, UserRegistry userRegistry, ConnectionSet connections) {
        if (settings == null || userRegistry == null || connections == null) {
            throw new IllegalArgumentException("settings, userRegistry and connections are required");
        }
        this.settings = settings;
        this.userRegistry = userRegistry;
        this.connections = connections;
    }

    public RelaySettings getSettings() {
        return settings;
    }

    public UserRegistry getUserRegistry() {
        return userRegistry;
    }

    public ConnectionSet getConnections() {
        return connections;
    }

    /**
     * e.g. {@code 3 client(s) / 2 user(s)}
     */
    public String statsLine() {
        return connections.size() + " client(s) / " + userRegistry.getOnlineCount() + " user(s)";
    }

    public void logStats() {
        LoggerUtil.info(statsLine());
    }
}
