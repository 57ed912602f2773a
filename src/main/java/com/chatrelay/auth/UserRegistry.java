/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.auth;

import com.chatrelay.protocol.ChatSession;
import com.chatrelay.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of identified users: username -> live session.
 * Thread-safe using ConcurrentHashMap.
 *
 * <p>Usernames are stored as given. The login grammar is case-insensitive but
 * lookups are not, so {@code alice} and {@code ALICE} are separate users.
 *
 * <p>One instance is created at startup and shared by every connection handler.
 */
public class UserRegistry {

    private final ConcurrentHashMap<String, ChatSession> sessions = new ConcurrentHashMap<>();

    /**
     * Claim a username for a session.
     *
     * <p><b>Thread Safety:</b><br>
     * Check and insert are a single {@code putIfAbsent}, so when several
     * connections race for the same name exactly one of them wins.
     *
     * @param username The username to claim (already validated)
     * @param session The session that will own it
     * @return true if registered, false if the name is already taken
     */
    public boolean register(String username, ChatSession session) {
        if (username == null || username.isEmpty() || session == null) {
            LoggerUtil.warn("Cannot register user with empty username or null session");
            return false;
        }

        ChatSession existing = sessions.putIfAbsent(username, session);
        if (existing != null) {
            LoggerUtil.debug("Username '" + username + "' already taken");
            return false;
        }

        LoggerUtil.debug("User '" + username + "' registered (total online: " + sessions.size() + ")");
        return true;
    }

    /**
     * Release a username, but only if it is still owned by {@code session}.
     *
     * @param username The username to release
     * @param session The session that registered it
     * @return true if an entry was removed
     */
    public boolean unregister(String username, ChatSession session) {
        if (username == null || username.isEmpty() || session == null) {
            return false;
        }

        boolean removed = sessions.remove(username, session);
        if (removed) {
            LoggerUtil.debug("User '" + username + "' unregistered (total online: " + sessions.size() + ")");
        }
        return removed;
    }

    public boolean isOnline(String username) {
        return username != null && sessions.containsKey(username);
    }

    /**
     * @return the session registered under {@code username}, or null
     */
    public ChatSession getSession(String username) {
        if (username == null) {
            return null;
        }
        return sessions.get(username);
    }

    /**
     * Copy of the registered sessions taken for one broadcast.
     *
     * <p>Every entry registered before the call and not removed during it is
     * included; logins that race with the call may or may not be.
     */
    public List<ChatSession> snapshot() {
        return new ArrayList<>(sessions.values());
    }

    public List<String> getOnlineUsernames() {
        return new ArrayList<>(sessions.keySet());
    }

    public int getOnlineCount() {
        return sessions.size();
    }

    /**
     * Clear all entries.
     * Primarily for testing purposes.
     */
    public void clear() {
        int count = sessions.size();
        sessions.clear();
        LoggerUtil.info("UserRegistry cleared (" + count + " users removed)");
    }
}
