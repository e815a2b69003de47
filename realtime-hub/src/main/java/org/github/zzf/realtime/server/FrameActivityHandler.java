package org.github.zzf.realtime.server;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;

/**
 * fires {@link Event#FRAME_RECEIVED} for every inbound WebSocket frame before it is decoded.
 * <p>Placed in front of the WebSocket protocol handler, so ping / pong / binary frames and frames that never decode
 * into a message are reported as well.</p>
 */
@ChannelHandler.Sharable
public class FrameActivityHandler extends ChannelInboundHandlerAdapter {

    public static final FrameActivityHandler INSTANCE = new FrameActivityHandler();

    public enum Event {
        FRAME_RECEIVED,
    }

    private FrameActivityHandler() {
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof WebSocketFrame) {
            ctx.fireUserEventTriggered(Event.FRAME_RECEIVED);
        }
        super.channelRead(ctx, msg);
    }

}
