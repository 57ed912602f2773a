/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

/**
 * Coded failure replies. A failure never changes connection state.
 */
public enum FailureCode {
    UNKNOWN_COMMAND("FAIL00", "Unknown command"),
    USER_EXISTS("FAIL01", "User already logged in"),
    INVALID_USERNAME("FAIL02", "Username has an invalid format or length"),
    NOT_LOGGED_IN("FAIL03", "Please log in first"),
    ALREADY_LOGGED_IN("FAIL04", "User cannot login twice"),
    PONG_WITHOUT_PING("FAIL05", "Pong without ping");

    private final String code;
    private final String description;

    FailureCode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * Full wire text, e.g. {@code FAIL03 Please log in first}.
     */
    public String toMessage() {
        return code + " " + description;
    }
}
