/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.protocol;

import com.chatrelay.auth.UserRegistry;
import com.chatrelay.config.RelaySettings;
import com.chatrelay.protocol.CommandParser.ParsedCommand;
import com.chatrelay.state.RelayContext;
import com.chatrelay.utils.LoggerUtil;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-connection protocol state machine.
 * <p>
 * One instance per channel. Inbound bytes are framed into lines, each line is
 * split into command and payload and dispatched. All of this instance's
 * mutable state is touched only from the channel's event loop; other
 * connections reach it through {@link ChatSession#send(String)}, which is
 * thread-safe because Netty hands cross-thread writes to the owning loop.
 * <p>
 * Every close path (QUIT, overflow, pong timeout, peer half-close, transport
 * error) ends in {@link #channelInactive}, which performs teardown once.
 */
public class ChatClientHandler extends ChannelInboundHandlerAdapter implements ChatSession {

    private static final AtomicInteger NEXT_CONN_ID = new AtomicInteger(1);

    private final RelayContext context;
    private final RelaySettings settings;
    private final UserRegistry userRegistry;

    private final int connectionId = NEXT_CONN_ID.getAndIncrement();
    private final LineFramer framer;

    private volatile ChannelHandlerContext ctx;
    private volatile String remote = "";
    private volatile String username = "";
    private volatile ConnectionState state = ConnectionState.UNIDENTIFIED;

    private HeartbeatController heartbeat;
    private boolean tornDown = false;

    public ChatClientHandler(RelayContext context) {
        this.context = context;
        this.settings = context.getSettings();
        this.userRegistry = context.getUserRegistry();
        this.framer = new LineFramer("[conn " + connectionId + "] ", settings.getMaxPending());
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.ctx = ctx;
        this.remote = describe(ctx.channel().remoteAddress());
        context.getConnections().add(this);
        LoggerUtil.info(prefix() + "Connection ESTABLISHED");

        // INIT is the handshake announcement; the peer never acknowledges it.
        sendMessage(ChatProtocol.init(settings.getVersion()));
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        teardown();
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        final ByteBuf buf = (ByteBuf) msg;
        final byte[] in = new byte[buf.readableBytes()];
        try {
            buf.readBytes(in);
        } finally {
            buf.release();
        }

        if (state == ConnectionState.CLOSED) {
            return;
        }

        List<String> lines = framer.accumulate(in);
        for (String line : lines) {
            if (state == ConnectionState.CLOSED) {
                LoggerUtil.debug(() -> prefix() + "Ignoring line received after close: " + line);
                continue;
            }
            processMessage(line);
        }

        if (state == ConnectionState.CLOSED) {
            return;
        }
        try {
            framer.ensureWithinLimit();
        } catch (LineOverflowException e) {
            LoggerUtil.warn(prefix() + "too many pending characters - " + e.getMessage());
            sendAndClose(ChatProtocol.disconnect(ChatProtocol.REASON_UNTERMINATED));
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownEvent) {
            if (state != ConnectionState.CLOSED) {
                LoggerUtil.warn(prefix() + "client closed connection unexpectedly");
                closeConnection();
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LoggerUtil.error(prefix() + "Pipeline error: " + cause);
        closeConnection();
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (!ctx.channel().isWritable()) {
            LoggerUtil.warn(prefix() + "Backpressure START | needToFlush="
                    + ctx.channel().bytesBeforeWritable() + " bytes");
        } else {
            LoggerUtil.debug(prefix() + "Backpressure END | bufferHeadroom="
                    + ctx.channel().bytesBeforeUnwritable() + " bytes");
        }
        super.channelWritabilityChanged(ctx);
    }

    // -------------------------------------------------------------------------
    // Command dispatch
    // -------------------------------------------------------------------------

    private void processMessage(String message) {
        LoggerUtil.info(prefix() + "--> " + message);
        ParsedCommand parsed = CommandParser.parse(message);
        switch (parsed.command) {
            case ChatProtocol.CMD_BROADCAST:
                processBroadcast(parsed.payload);
                break;
            case ChatProtocol.CMD_LOGIN:
                processLogin(parsed.payload);
                break;
            case ChatProtocol.CMD_PONG:
                processPong();
                break;
            case ChatProtocol.CMD_QUIT:
                processQuit();
                break;
            default:
                sendFailure(FailureCode.UNKNOWN_COMMAND);
        }
    }

    private void processLogin(String name) {
        if (state == ConnectionState.IDENTIFIED) {
            sendFailure(FailureCode.ALREADY_LOGGED_IN);
        } else if (!ChatProtocol.isValidUsername(name)) {
            sendFailure(FailureCode.INVALID_USERNAME);
        } else if (!userRegistry.register(name, this)) {
            sendFailure(FailureCode.USER_EXISTS);
        } else {
            username = name;
            state = ConnectionState.IDENTIFIED;
            if (settings.isHeartbeatEnabled()) {
                startHeartbeat();
            }
            sendMessage(ChatProtocol.confirmLogin(name));
            context.logStats();
        }
    }

    private void processBroadcast(String text) {
        if (state != ConnectionState.IDENTIFIED) {
            sendFailure(FailureCode.NOT_LOGGED_IN);
            return;
        }
        String relayed = ChatProtocol.broadcast(username, text);
        for (ChatSession session : userRegistry.snapshot()) {
            if (session == this) {
                sendMessage(ChatProtocol.confirmBroadcast(text));
            } else {
                session.send(relayed);
            }
        }
    }

    private void processPong() {
        if (heartbeat == null || !heartbeat.onPong()) {
            sendFailure(FailureCode.PONG_WITHOUT_PING);
        }
    }

    private void processQuit() {
        sendAndClose(ChatProtocol.goodbye());
    }

    private void startHeartbeat() {
        heartbeat = new HeartbeatController(
                ctx.executor(),
                settings.getHeartbeatIntervalMs(),
                settings.getHeartbeatTimeoutMs(),
                () -> sendMessage(ChatProtocol.CMD_PING),
                () -> sendAndClose(ChatProtocol.disconnect(ChatProtocol.REASON_PONG_TIMEOUT)),
                this::prefix);
        heartbeat.start();
    }

    // -------------------------------------------------------------------------
    // Outbound path
    // -------------------------------------------------------------------------

    @Override
    public void send(String message) {
        sendMessage(message);
    }

    private void sendFailure(FailureCode failure) {
        sendMessage(failure.toMessage());
    }

    /**
     * Write one message plus terminator. Failures are logged and close the
     * channel; teardown then runs from {@link #channelInactive}.
     * <p>
     * Writes start at the tail of the pipeline so the outbound logger sees them.
     */
    private ChannelFuture sendMessage(String message) {
        LoggerUtil.info(prefix() + "<-- " + message);
        ByteBuf out = Unpooled.copiedBuffer(message + ChatProtocol.LINE_SEPARATOR, StandardCharsets.UTF_8);
        ChannelFuture future = ctx.channel().writeAndFlush(out);
        future.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                LoggerUtil.error(prefix() + "transmission error: " + f.cause());
                f.channel().close();
            }
        });
        return future;
    }

    /**
     * Notify the peer, then close once the message has been written.
     */
    private void sendAndClose(String message) {
        state = ConnectionState.CLOSED;
        sendMessage(message).addListener(ChannelFutureListener.CLOSE);
    }

    private void closeConnection() {
        state = ConnectionState.CLOSED;
        if (ctx != null) {
            ctx.close();
        }
    }

    private void teardown() {
        if (tornDown) {
            return;
        }
        tornDown = true;
        state = ConnectionState.CLOSED;

        if (heartbeat != null) {
            heartbeat.stop();
        }
        if (!username.isEmpty()) {
            userRegistry.unregister(username, this);
        }
        context.getConnections().remove(this);

        int discardedBytes = framer.clearAndReset();
        if (discardedBytes > 0) {
            LoggerUtil.warn(prefix() + String.format("Connection closed with %d unterminated bytes buffered", discardedBytes));
        }

        LoggerUtil.info(prefix() + "removed client");
        context.logStats();
    }

    // -------------------------------------------------------------------------
    // Accessors / helpers
    // -------------------------------------------------------------------------

    @Override
    public String getUsername() {
        return username;
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isHeartbeatRunning() {
        return heartbeat != null && heartbeat.isRunning();
    }

    /**
     * Log prefix with connection id, remote address and username (empty before login).
     */
    private String prefix() {
        return "[conn " + connectionId + "] " + remote + " (" + username + ") ";
    }

    private static String describe(SocketAddress address) {
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return inet.getHostString() + ":" + inet.getPort();
        }
        return address != null ? address.toString() : "";
    }
}
