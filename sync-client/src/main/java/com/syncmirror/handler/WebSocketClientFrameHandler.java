package com.syncmirror.handler;

import com.syncmirror.error.TransportException;
import com.syncmirror.transport.TransportListener;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the client side of one WebSocket connection.
 *
 * - Drives the RFC 6455 opening handshake and exposes it as {@link #handshakeFuture()}
 * - Hands text frames to the {@link TransportListener}
 * - Answers ping frames and closes on close frames
 * - Reports the channel's end exactly once through {@link TransportListener#onClosed}
 *
 * Threading Model:
 * - Each channel is handled by a single Netty event loop thread
 * - Listener callbacks therefore arrive in wire order for this connection
 *
 * Important: Never block in this handler! Listeners must hand work off quickly.
 */
public class WebSocketClientFrameHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketClientFrameHandler.class);

    private final WebSocketClientHandshaker handshaker;
    private final TransportListener listener;
    private ChannelPromise handshakeFuture;
    private Throwable failureCause;

    public WebSocketClientFrameHandler(WebSocketClientHandshaker handshaker, TransportListener listener) {
        this.handshaker = handshaker;
        this.listener = listener;
    }

    public ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    /**
     * Called when the TCP connection is established; starts the upgrade.
     */
    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    /**
     * Called when the connection is closed.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.setFailure(new TransportException("Connection closed during WebSocket handshake"));
        }
        logger.debug("Channel {} closed", ctx.channel().id().asShortText());
        listener.onClosed(failureCause);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        Channel ch = ctx.channel();
        if (!handshaker.isHandshakeComplete()) {
            if (msg instanceof FullHttpResponse) {
                try {
                    handshaker.finishHandshake(ch, (FullHttpResponse) msg);
                    handshakeFuture.setSuccess();
                } catch (WebSocketHandshakeException e) {
                    failureCause = e;
                    handshakeFuture.setFailure(e);
                }
            }
            return;
        }

        if (msg instanceof FullHttpResponse) {
            FullHttpResponse response = (FullHttpResponse) msg;
            throw new IllegalStateException("Unexpected FullHttpResponse (status=" + response.status() + ")");
        }

        WebSocketFrame frame = (WebSocketFrame) msg;
        if (frame instanceof TextWebSocketFrame) {
            listener.onText(((TextWebSocketFrame) frame).text());
        } else if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        } else if (frame instanceof PongWebSocketFrame) {
            logger.trace("Transport-level pong on {}", ch.id().asShortText());
        } else if (frame instanceof CloseWebSocketFrame) {
            logger.debug("Close frame received on {}", ch.id().asShortText());
            ch.close();
        } else {
            logger.warn("Unsupported frame type: {}", frame.getClass().getName());
        }
    }

    /**
     * Handles idle state events (no inbound traffic for too long).
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                failureCause = new TransportException("Reader idle timeout");
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("WebSocket error on {}", ctx.channel().id().asShortText(), cause);
        failureCause = cause;
        if (!handshakeFuture.isDone()) {
            handshakeFuture.setFailure(cause);
        }
        ctx.close();
    }
}
