/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

import java.util.regex.Pattern;

/**
 * Wire vocabulary of the relay (single source of truth).
 */
public final class ChatProtocol {

    // Commands
    public static final String CMD_BROADCAST = "BCST";
    public static final String CMD_CONFIRM = "OK";
    public static final String CMD_DISCONNECT = "DSCN";
    public static final String CMD_INIT = "INIT";
    public static final String CMD_LOGIN = "IDENT";
    public static final String CMD_PING = "PING";
    public static final String CMD_PONG = "PONG";
    public static final String CMD_QUIT = "QUIT";

    // Disconnect reasons
    public static final String REASON_UNTERMINATED = "Unterminated message";
    public static final String REASON_PONG_TIMEOUT = "Pong timeout";

    /** Outbound line terminator. */
    public static final String LINE_SEPARATOR = "\n";

    /** 3 to 14 letters, digits or underscores. */
    public static final Pattern USERNAME = Pattern.compile("^[A-Z0-9_]{3,14}$", Pattern.CASE_INSENSITIVE);

    public static boolean isValidUsername(String name) {
        return name != null && USERNAME.matcher(name).matches();
    }

    public static String init(String version) {
        return CMD_INIT + " Welcome to the server " + version;
    }

    public static String confirmLogin(String username) {
        return CMD_CONFIRM + " " + CMD_LOGIN + " " + username;
    }

    public static String confirmBroadcast(String text) {
        return CMD_CONFIRM + " " + CMD_BROADCAST + " " + text;
    }

    public static String goodbye() {
        return CMD_CONFIRM + " Goodbye";
    }

    public static String broadcast(String sender, String text) {
        return CMD_BROADCAST + " " + sender + " " + text;
    }

    public static String disconnect(String reason) {
        return CMD_DISCONNECT + " " + reason;
    }

    private ChatProtocol() {}
}
