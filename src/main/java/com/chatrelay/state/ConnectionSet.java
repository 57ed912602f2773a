/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.state;

import com.chatrelay.protocol.ChatSession;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All live connections, identified or not. Only used for counts.
 */
public class ConnectionSet {

    private final Set<ChatSession> sessions = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the session was not yet tracked
     */
    public boolean add(ChatSession session) {
        return sessions.add(session);
    }

    /**
     * @return true if the session was tracked
     */
    public boolean remove(ChatSession session) {
        return sessions.remove(session);
    }

    public boolean contains(ChatSession session) {
        return sessions.contains(session);
    }

    public int size() {
        return sessions.size();
    }
}
