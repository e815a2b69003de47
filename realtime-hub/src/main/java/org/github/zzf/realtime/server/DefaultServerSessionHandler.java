package org.github.zzf.realtime.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler.HandshakeComplete;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Message;
import org.github.zzf.realtime.protocol.server.Hub;
import org.github.zzf.realtime.protocol.server.MessageHandler;
import org.github.zzf.realtime.protocol.server.ServerSession;

/**
 * the reader side of a session.
 * <p>The session is created once the WebSocket handshake is complete.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultServerSessionHandler extends ChannelInboundHandlerAdapter {

    public static final ChannelFutureListener LOG_ON_FAILURE = future -> {
        if (!future.isSuccess()) {
            log.error("Channel(" + future.channel() + ").writeAndFlush failed.", future.cause());
        }
    };

    public static final String HANDLER_NAME = DefaultServerSessionHandler.class.getSimpleName();

    private final Hub hub;
    private final MessageHandler messageHandler;
    private final int outboundCapacity;

    protected DefaultServerSession session;

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof HandshakeComplete hc) {
            log.debug("Channel({}) handshake complete -> uri: {}", ctx.channel(), hc.requestUri());
            establish(ctx);
        }
        else if (evt == FrameActivityHandler.Event.FRAME_RECEIVED) {
            if (session != null) {
                session.touch();
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    void establish(ChannelHandlerContext ctx) {
        if (session != null) {
            log.error("Client({}) handshake completed more than once, now close the channel", csci());
            ctx.channel().close();
            return;
        }
        String clientIdentifier = ctx.channel().attr(AdmissionHandler.CLIENT_ID).get();
        if (clientIdentifier == null) {
            log.error("Channel({}) has no client identifier, now close the channel", ctx.channel());
            ctx.channel().close();
            return;
        }
        session = new DefaultServerSession(clientIdentifier, ctx.channel(), hub, outboundCapacity);
        session.established();
        log.info("Client({}) connected -> session: {}, channel: {}", clientIdentifier, session.id(), ctx.channel());
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof Message m)) {
            // Close / Continuation frames, released by the tail
            ctx.fireChannelRead(msg);
            return;
        }
        if (session == null) {
            log.warn("Channel({}) receive message before the handshake, drop it -> {}", ctx.channel(), m);
            return;
        }
        session.touch();
        switch (m.kind()) {
            case SUBSCRIBE -> session.subscribe(m.topic());
            case UNSUBSCRIBE -> session.unsubscribe(m.topic());
            case HEARTBEAT, PONG -> log.debug("Client({}) alive -> {}", csci(), m.type());
            case PING -> session.offer(Message.pong());
            default -> dispatch(m);
        }
    }

    private void dispatch(Message m) {
        try {
            messageHandler.onMessage(session.clientIdentifier(), m);
        } catch (RuntimeException e) {
            log.error("Client({}) MessageHandler failed, the session is kept -> {}", csci(), m, e);
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (session != null && ctx.channel().isWritable()) {
            session.resumeDrain();
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Client({}) exceptionCaught. now close the session -> channel: {}", csci(), ctx.channel(), cause);
        if (session != null) {
            session.close();
        }
        else {
            ctx.channel().close();
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Client({}) channelInactive", csci());
        super.channelInactive(ctx);
    }

    private String csci() {
        return Optional.ofNullable(session).map(ServerSession::clientIdentifier).orElse(null);
    }

    ServerSession session() {
        return session;
    }

}
