/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

import com.chatrelay.utils.LoggerUtil;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits an inbound byte stream into text lines.
 *
 * <p>Any of {@code \r\n}, {@code \r} or {@code \n} ends a line, the same rule
 * {@link java.io.BufferedReader#readLine()} applies. Terminators are stripped.
 * Bytes after the last terminator are held until a later chunk completes them,
 * and a {@code \r} that ends one chunk swallows a {@code \n} that starts the
 * next, so the lines produced never depend on how the stream was chunked.
 *
 * <p>Lines are decoded as UTF-8 only once complete, which keeps multi-byte
 * characters intact when a segment boundary falls inside one. The pending
 * limit is counted in characters: every byte that is not a UTF-8
 * continuation byte ({@code 10xxxxxx}) starts a new one.
 *
 * <h3>Usage Pattern:</h3>
 * <pre>
 * LineFramer framer = new LineFramer("[conn 7] ", 1024);
 *
 * // On each channelRead:
 * for (String line : framer.accumulate(bytes)) {
 *     dispatch(line);
 * }
 * framer.ensureWithinLimit();   // throws LineOverflowException
 *
 * // On channelInactive:
 * int discarded = framer.clearAndReset();
 * </pre>
 *
 * <h3>Thread Safety:</h3>
 * Not thread-safe. One instance belongs to one channel and is only touched
 * from that channel's event loop.
 */
public class LineFramer {

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private int pendingChars = 0;
    private final int maxPending;
    private final String logPrefix;

    // Set after a line ended in CR: a directly following LF belongs to the same terminator.
    private boolean skipLineFeed = false;

    /**
     * @param logPrefix Prefix for diagnostic log messages (e.g. connection identifier)
     * @param maxPending Maximum number of unterminated characters to hold
     */
    public LineFramer(String logPrefix, int maxPending) {
        if (maxPending <= 0) {
            throw new IllegalArgumentException("maxPending must be positive: " + maxPending);
        }
        this.logPrefix = logPrefix != null ? logPrefix : "";
        this.maxPending = maxPending;
    }

    /**
     * Appends a chunk and returns every line it completes, in arrival order.
     *
     * @param chunk newly received bytes
     * @return completed lines without terminators (possibly empty, never null)
     */
    public List<String> accumulate(byte[] chunk) {
        if (chunk.length == 0) {
            return Collections.emptyList();
        }

        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < chunk.length; i++) {
            byte b = chunk[i];
            if (skipLineFeed) {
                skipLineFeed = false;
                if (b == LF) {
                    start = i + 1;
                    continue;
                }
            }
            if (b == CR || b == LF) {
                pending.write(chunk, start, i - start);
                lines.add(pending.toString(StandardCharsets.UTF_8));
                pending.reset();
                pendingChars = 0;
                skipLineFeed = (b == CR);
                start = i + 1;
            }
        }
        pending.write(chunk, start, chunk.length - start);
        for (int i = start; i < chunk.length; i++) {
            if ((chunk[i] & 0xC0) != 0x80) {
                pendingChars++;
            }
        }

        if (pendingChars > 0) {
            LoggerUtil.debug(() -> logPrefix + String.format(
                    "Line framing: %d line(s) complete, %d char(s) held for next segment",
                    lines.size(), pendingChars));
        }
        return lines;
    }

    /**
     * Verifies the unterminated remainder is within the configured bound.
     * Called after the completed lines of a chunk have been processed.
     *
     * @throws LineOverflowException if more than {@code maxPending} characters are held
     */
    public void ensureWithinLimit() throws LineOverflowException {
        if (pendingChars > maxPending) {
            throw new LineOverflowException("Unterminated line exceeds limit", pendingChars, maxPending);
        }
    }

    /**
     * Drops all buffered state.
     *
     * @return number of bytes discarded
     */
    public int clearAndReset() {
        int discarded = pending.size();
        pending.reset();
        pendingChars = 0;
        skipLineFeed = false;
        return discarded;
    }

    public boolean hasBufferedData() {
        return pending.size() > 0;
    }

    public int getBufferedByteCount() {
        return pending.size();
    }

    public int getBufferedCharCount() {
        return pendingChars;
    }
}
