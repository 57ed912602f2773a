/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

/**
 * Lifecycle of one client connection.
 * UNIDENTIFIED -> IDENTIFIED -> CLOSED, or UNIDENTIFIED -> CLOSED. CLOSED is terminal.
 */
public enum ConnectionState {
    UNIDENTIFIED,
    IDENTIFIED,
    CLOSED
}
