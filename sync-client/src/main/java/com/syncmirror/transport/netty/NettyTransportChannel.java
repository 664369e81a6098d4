package com.syncmirror.transport.netty;

import com.syncmirror.error.SendFailureException;
import com.syncmirror.transport.TransportChannel;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A handshaken WebSocket channel.
 *
 * Writes are thread-safe - Netty queues them onto the channel's event loop.
 * A write that fails asynchronously closes the channel, which the pool then sees
 * as a transport-level close.
 */
class NettyTransportChannel implements TransportChannel {

    private static final Logger logger = LoggerFactory.getLogger(NettyTransportChannel.class);

    private final Channel channel;

    NettyTransportChannel(Channel channel) {
        this.channel = channel;
    }

    @Override
    public String id() {
        return channel.id().asShortText();
    }

    @Override
    public void send(String text) {
        if (!channel.isActive()) {
            throw new SendFailureException("Channel " + id() + " is not active");
        }
        if (!channel.isWritable()) {
            throw new SendFailureException("Channel " + id() + " is not writable");
        }
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                logger.warn("Write failed on {}, closing", id(), future.cause());
                future.channel().close();
            }
        });
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public void close() {
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "NettyTransportChannel{" + id() + ", active=" + channel.isActive() + '}';
    }
}
