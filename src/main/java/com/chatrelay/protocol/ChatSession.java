/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

/**
 * View of a live client connection as seen by shared state and by other
 * connections. Registries hold these as non-owning references.
 */
public interface ChatSession {

    /**
     * @return the identified username, or an empty string before login
     */
    String getUsername();

    /**
     * Queues one protocol message (without terminator) for delivery.
     * Safe to call from any thread; never blocks. Delivery failures are
     * handled by this session's own error path.
     */
    void send(String message);
}
