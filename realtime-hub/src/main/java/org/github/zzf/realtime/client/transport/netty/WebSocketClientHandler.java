package org.github.zzf.realtime.client.transport.netty;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler.ClientHandshakeStateEvent;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.client.transport.Connection;
import org.github.zzf.realtime.client.transport.ConnectionListener;

/**
 * adapts one Netty channel to a {@link Connection}.
 * <p>Ping frames are answered by the protocol handler, pong frames are dropped there.</p>
 */
@Slf4j
public class WebSocketClientHandler extends SimpleChannelInboundHandler<WebSocketFrame> implements Connection {

    public static final String HANDLER_NAME = WebSocketClientHandler.class.getSimpleName();

    private final ConnectionListener listener;
    private final AtomicBoolean closeNotified = new AtomicBoolean(false);
    private volatile Channel channel;
    private volatile boolean handshaken;
    private volatile int closeCode = WebSocketCloseStatus.ABNORMAL_CLOSURE.code();
    private volatile String closeReason = "connection lost";

    public WebSocketClientHandler(ConnectionListener listener) {
        this.listener = listener;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.channel = ctx.channel();
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            handshaken = true;
            log.debug("Channel({}) handshake complete", ctx.channel());
            listener.onOpen(this);
        }
        else if (evt == ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            closeReason = "handshake timeout";
            listener.onError(new TimeoutException("WebSocket handshake timeout"));
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame tf) {
            listener.onText(tf.text());
        }
        else if (frame instanceof CloseWebSocketFrame cf) {
            closeCode = cf.statusCode();
            closeReason = cf.reasonText();
            log.debug("Channel({}) close frame received -> {} {}", ctx.channel(), closeCode, closeReason);
            ctx.writeAndFlush(new CloseWebSocketFrame(closeCode, closeReason)).addListener(ChannelFutureListener.CLOSE);
        }
        else {
            log.debug("Channel({}) frame ignored -> {}", ctx.channel(), frame);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel({}) exceptionCaught. now close the channel", ctx.channel(), cause);
        closeReason = String.valueOf(cause.getMessage());
        listener.onError(cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        notifyClosed(closeCode, closeReason);
        super.channelInactive(ctx);
    }

    /**
     * the TCP connect failed, no channel event follows
     */
    void connectFailed(Throwable cause) {
        listener.onError(cause);
        notifyClosed(WebSocketCloseStatus.ABNORMAL_CLOSURE.code(), "connect failed: " + cause.getMessage());
    }

    private void notifyClosed(int code, String reason) {
        if (closeNotified.compareAndSet(false, true)) {
            listener.onClose(code, reason);
        }
    }

    @Override
    public boolean isOpen() {
        Channel ch = channel;
        return handshaken && ch != null && ch.isActive() && !closeNotified.get();
    }

    @Override
    public boolean send(String text) {
        if (!isOpen()) {
            return false;
        }
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.error("Channel({}) write failed, now close the channel", f.channel(), f.cause());
                f.channel().close();
            }
        });
        return true;
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (ch.isActive() && handshaken) {
            closeCode = WebSocketCloseStatus.NORMAL_CLOSURE.code();
            closeReason = "closed by client";
            ch.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                .addListener(ChannelFutureListener.CLOSE);
        }
        else {
            ch.close();
        }
    }

}
