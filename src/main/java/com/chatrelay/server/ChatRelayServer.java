/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.server;

import com.chatrelay.config.RelaySettings;
import com.chatrelay.protocol.ChatClientHandler;
import com.chatrelay.state.RelayContext;
import com.chatrelay.utils.LoggerUtil;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;

import java.net.InetSocketAddress;

/**
 * Accepts TCP connections and gives each one its own {@link ChatClientHandler}.
 * The shared {@link RelayContext} is created here once and injected into every handler.
 */
public class ChatRelayServer {

    private final RelaySettings settings;
    private final RelayContext context;

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;

    public ChatRelayServer(RelaySettings settings) {
        this(settings, new RelayContext(settings));
    }

    public ChatRelayServer(RelaySettings settings, RelayContext context) {
        this.settings = settings;
        this.context = context;
    }

    /**
     * Binds the listening socket. Returns once the server accepts connections.
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap sb = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<Channel>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            ch.pipeline().addLast("logger-in", new LoggingHandler("INBOUND", LogLevel.DEBUG));
                            ch.pipeline().addLast("chat", new ChatClientHandler(context));
                            ch.pipeline().addLast("logger-out", new LoggingHandler("OUTBOUND", LogLevel.DEBUG));
                        }
                    })
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    // Surface the peer's FIN as an event so it can be treated as an unexpected disconnect.
                    .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                    .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(32 * 1024, 64 * 1024));

            LoggerUtil.info("Binding " + settings.getBindAddress() + ":" + settings.getPort() + " ...");
            ChannelFuture bindFuture = sb.bind(settings.getBindAddress(), settings.getPort()).sync();
            serverChannel = bindFuture.channel();
            LoggerUtil.info("Server ready on " + settings.getBindAddress() + ":" + getBoundPort());

        } catch (Exception e) {
            if (bossGroup != null) bossGroup.shutdownGracefully();
            if (workerGroup != null) workerGroup.shutdownGracefully();
            throw e;
        }
    }

    /**
     * Closes the listener and all client channels.
     */
    public void stop() {
        try {
            if (serverChannel != null && serverChannel.isOpen()) serverChannel.close().sync();
            if (bossGroup != null) bossGroup.shutdownGracefully().sync();
            if (workerGroup != null) workerGroup.shutdownGracefully().sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.error("Interrupted while stopping: " + e.getMessage());
        }
    }

    /**
     * Actual listening port; differs from the configured one when that was 0.
     */
    public int getBoundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public RelayContext getContext() {
        return context;
    }
}
