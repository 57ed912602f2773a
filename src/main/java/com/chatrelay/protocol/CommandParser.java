/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

/**
 * Splits a framed line into command token and payload.
 *
 * Line grammar:
 *  - {@code <COMMAND>}            payload is empty
 *  - {@code <COMMAND> <payload>}  payload is everything after the first space
 *
 * No validation happens here; unknown commands and bad payloads are the
 * dispatcher's concern.
 */
public final class CommandParser {

    public static final class ParsedCommand {
        public final String command;
        public final String payload;

        public ParsedCommand(String command, String payload) {
            this.command = command;
            this.payload = payload;
        }

        @Override
        public String toString() {
            return payload.isEmpty() ? command : command + " " + payload;
        }
    }

    public static ParsedCommand parse(String line) {
        int space = line.indexOf(' ');
        if (space < 0) {
            return new ParsedCommand(line, "");
        }
        return new ParsedCommand(line.substring(0, space), line.substring(space + 1));
    }

    private CommandParser() {}
}
