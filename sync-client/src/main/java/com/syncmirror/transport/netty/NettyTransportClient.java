package com.syncmirror.transport.netty;

import com.syncmirror.error.TransportException;
import com.syncmirror.handler.WebSocketClientFrameHandler;
import com.syncmirror.transport.SyncTransportClient;
import com.syncmirror.transport.TransportChannel;
import com.syncmirror.transport.TransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket transport binding using Netty's NIO client.
 *
 * Threading Model:
 * - One shared event loop group serves every pooled connection
 * - Each connection is pinned to one loop thread, so its inbound frames are
 *   delivered in wire order
 *
 * Pipeline per connection:
 * [SSL] → HTTP codec → aggregator → [idle detection] → client frame handler
 */
public class NettyTransportClient implements SyncTransportClient {

    private static final Logger logger = LoggerFactory.getLogger(NettyTransportClient.class);
    private static final int MAX_FRAME_SIZE = 65536;

    private final EventLoopGroup group;
    private final int connectTimeoutMs;
    private final int readerIdleSeconds;

    /**
     * @param ioThreads         event loop threads (0 = Netty default, 2 * cores)
     * @param connectTimeoutMs  TCP connect timeout
     * @param readerIdleSeconds close a connection with no inbound traffic for this long (0 = off)
     */
    public NettyTransportClient(int ioThreads, int connectTimeoutMs, int readerIdleSeconds) {
        this.group = new NioEventLoopGroup(ioThreads, new DefaultThreadFactory("sync-client-io", true));
        this.connectTimeoutMs = connectTimeoutMs;
        this.readerIdleSeconds = readerIdleSeconds;
    }

    public NettyTransportClient() {
        this(1, 5000, 0);
    }

    @Override
    public CompletableFuture<TransportChannel> open(URI endpoint, TransportListener listener) {
        CompletableFuture<TransportChannel> result = new CompletableFuture<>();

        String scheme = endpoint.getScheme() == null ? "ws" : endpoint.getScheme().toLowerCase();
        if (!"ws".equals(scheme) && !"wss".equals(scheme)) {
            result.completeExceptionally(new TransportException("Unsupported scheme: " + endpoint));
            return result;
        }
        boolean secure = "wss".equals(scheme);
        int port = endpoint.getPort() != -1 ? endpoint.getPort() : (secure ? 443 : 80);

        final SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            result.completeExceptionally(new TransportException("Cannot initialise TLS for " + endpoint, e));
            return result;
        }

        // A fresh handshaker per connection: it tracks handshake state for exactly one channel
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                endpoint, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), MAX_FRAME_SIZE);
        WebSocketClientFrameHandler frameHandler = new WebSocketClientFrameHandler(handshaker, listener);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true) // Disable Nagle for low latency
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc(), endpoint.getHost(), port));
                        }
                        pipeline.addLast(new HttpClientCodec());
                        pipeline.addLast(new HttpObjectAggregator(MAX_FRAME_SIZE));
                        if (readerIdleSeconds > 0) {
                            pipeline.addLast(new IdleStateHandler(readerIdleSeconds, 0, 0, TimeUnit.SECONDS));
                        }
                        pipeline.addLast(frameHandler);
                    }
                });

        bootstrap.connect(endpoint.getHost(), port).addListener((ChannelFutureListener) connectFuture -> {
            if (!connectFuture.isSuccess()) {
                result.completeExceptionally(
                        new TransportException("Failed to connect to " + endpoint, connectFuture.cause()));
                return;
            }
            Channel channel = connectFuture.channel();
            frameHandler.handshakeFuture().addListener(handshake -> {
                if (handshake.isSuccess()) {
                    logger.debug("WebSocket handshake complete with {} on {}", endpoint, channel.id().asShortText());
                    result.complete(new NettyTransportChannel(channel));
                } else {
                    result.completeExceptionally(
                            new TransportException("WebSocket handshake failed with " + endpoint, handshake.cause()));
                    channel.close();
                }
            });
        });
        return result;
    }

    /**
     * Gracefully shuts down the I/O threads.
     */
    @Override
    public void shutdown() {
        logger.info("Shutting down transport event loop...");
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }
}
