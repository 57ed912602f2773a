/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

/**
 * Thrown when a peer sends more unterminated data than the line buffer allows.
 * The connection cannot recover from this and must be closed.
 */
public class LineOverflowException extends Exception {
    private final int bufferedChars;
    private final int limit;

    /**
     * @param message Error description
     * @param bufferedChars Number of unterminated characters held when the limit was hit
     * @param limit Configured maximum
     */
    public LineOverflowException(String message, int bufferedChars, int limit) {
        super(message + String.format(" (buffered: %d chars, limit: %d)", bufferedChars, limit));
        this.bufferedChars = bufferedChars;
        this.limit = limit;
    }

    public int getBufferedChars() {
        return bufferedChars;
    }

    public int getLimit() {
        return limit;
    }
}
