/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

import com.chatrelay.utils.LoggerUtil;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * PING/PONG liveness check for one identified connection.
 *
 * Transitions:
 *  - start():         arm the recurring ping task
 *  - ping tick:       send PING, arm the pong deadline, awaitingPong = true
 *  - onPong():        cancel the deadline, awaitingPong = false
 *  - deadline fires:  stop everything, hand over to the timeout handler
 *  - stop():          cancel both tasks (idempotent)
 *
 * All methods must run on the executor the tasks are scheduled on (the
 * channel's event loop), which keeps the fields confined to one thread.
 */
public class HeartbeatController {

    private final ScheduledExecutorService executor;
    private final long intervalMs;
    private final long timeoutMs;
    private final Runnable pingSender;
    private final Runnable timeoutHandler;
    private final Supplier<String> logPrefix;

    private ScheduledFuture<?> pingFuture;
    private ScheduledFuture<?> pongDeadline;
    private boolean awaitingPong = false;
    private boolean stopped = false;

    /**
     * @param executor scheduler for both tasks, normally {@code ctx.executor()}
     * @param intervalMs period between PINGs, must exceed {@code timeoutMs}
     * @param timeoutMs time allowed for the PONG
     * @param pingSender sends one PING to the peer
     * @param timeoutHandler notifies the peer and closes the connection
     * @param logPrefix supplies the connection's current log prefix
     */
    public HeartbeatController(ScheduledExecutorService executor, long intervalMs, long timeoutMs,
                               Runnable pingSender, Runnable timeoutHandler, Supplier<String> logPrefix) {
        if (intervalMs <= timeoutMs) {
            throw new IllegalArgumentException(String.format(
                    "Ping interval (%d ms) must be greater than pong timeout (%d ms)", intervalMs, timeoutMs));
        }
        this.executor = executor;
        this.intervalMs = intervalMs;
        this.timeoutMs = timeoutMs;
        this.pingSender = pingSender;
        this.timeoutHandler = timeoutHandler;
        this.logPrefix = logPrefix;
    }

    /**
     * Arms the recurring ping task. Only the first call has an effect.
     */
    public void start() {
        if (stopped || pingFuture != null) {
            LoggerUtil.warn(logPrefix.get() + "heartbeat already started or stopped - ignoring start");
            return;
        }
        LoggerUtil.info(logPrefix.get() + "heartbeat initiated");
        pingFuture = executor.scheduleAtFixedRate(this::onPingTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    void onPingTick() {
        if (stopped) {
            return;
        }
        if (awaitingPong) {
            // Only reachable if a deadline task was delayed past the next tick.
            LoggerUtil.warn(logPrefix.get() + "previous ping still unanswered - skipping this round");
            return;
        }
        pingSender.run();
        awaitingPong = true;
        pongDeadline = executor.schedule(this::onPongDeadline, timeoutMs, TimeUnit.MILLISECONDS);
    }

    void onPongDeadline() {
        if (stopped || !awaitingPong) {
            return;
        }
        pongDeadline = null;
        LoggerUtil.warn(logPrefix.get() + "heartbeat failure");
        stop();
        timeoutHandler.run();
    }

    /**
     * Handles an inbound PONG.
     *
     * @return true if a ping was outstanding and is now answered,
     *         false if there was nothing to answer
     */
    public boolean onPong() {
        if (!awaitingPong) {
            return false;
        }
        LoggerUtil.info(logPrefix.get() + "heartbeat success");
        cancelDeadline();
        awaitingPong = false;
        return true;
    }

    /**
     * Cancels both tasks. Safe to call more than once.
     */
    public void stop() {
        stopped = true;
        awaitingPong = false;
        cancelDeadline();
        if (pingFuture != null) {
            pingFuture.cancel(false);
            pingFuture = null;
        }
    }

    private void cancelDeadline() {
        if (pongDeadline != null) {
            pongDeadline.cancel(false);
            pongDeadline = null;
        }
    }

    public boolean isRunning() {
        return pingFuture != null && !stopped;
    }

    public boolean isAwaitingPong() {
        return awaitingPong;
    }
}
