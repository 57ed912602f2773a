/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Supplier;

/**
 * Console logging sink for the relay.
 *
 * <p>Every line is written to standard output as
 * {@code [yyyy-MM-dd HH:mm:ss.SSS][LEVEL] message} and kept in a bounded
 * history so recent activity can be inspected without scraping stdout.
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final int DEFAULT_HISTORY_CAPACITY = 500;

    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;

    private static final CircularBuffer<String> logHistory = new CircularBuffer<>(DEFAULT_HISTORY_CAPACITY);

    public static void log(String level, String msg) {
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "] " + msg;
        logHistory.add(line);
        if (!silent) {
            System.out.println(line);
        }
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }
    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled) {
            log("DEBUG", msgSupplier.get());
        }
    }

    /**
     * Logs an error together with the failure's stack summary.
     */
    public static void error(String msg, Throwable cause) {
        StringBuilder sb = new StringBuilder(msg).append(": ").append(cause);
        for (StackTraceElement frame : cause.getStackTrace()) {
            sb.append(System.lineSeparator()).append("    at ").append(frame);
        }
        log("ERROR", sb.toString());
    }

    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    /**
     * Suppresses console output. Lines still reach the history buffer.
     */
    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    public static List<String> getRecentLogs(int count) {
        return logHistory.getLast(count);
    }

    /**
     * True if any retained log line contains {@code fragment}.
     */
    public static boolean historyContains(String fragment) {
        for (String line : logHistory.getAll()) {
            if (line.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    public static void clearLogHistory() {
        logHistory.clear();
    }

    private LoggerUtil() {}
}
