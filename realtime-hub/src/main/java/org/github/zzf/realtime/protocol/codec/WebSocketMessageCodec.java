package org.github.zzf.realtime.protocol.codec;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.codec.MessageCodec.DecodeException;
import org.github.zzf.realtime.protocol.model.Message;

/**
 * <pre>
 *     inbound:     TextWebSocketFrame -> Message
 *                  PongWebSocketFrame -> Message(pong)
 *     outbound:    Message -> TextWebSocketFrame
 * </pre>
 * <p>A frame that can not be decoded is dropped, the channel stays open.</p>
 * <p>Other frames (Close / Ping) pass through untouched.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class WebSocketMessageCodec extends MessageToMessageCodec<WebSocketFrame, Message> {

    private final MessageCodec codec;

    @Override
    protected void encode(ChannelHandlerContext ctx, Message msg, List<Object> out) {
        out.add(new TextWebSocketFrame(codec.encode(msg)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, WebSocketFrame frame, List<Object> out) {
        if (frame instanceof TextWebSocketFrame tf) {
            String text = tf.text();
            try {
                codec.decode(text).ifPresent(out::add);
            } catch (DecodeException e) {
                log.warn("Channel({}) drop malformed frame: {} -> {}", ctx.channel(), e.getMessage(), text);
            }
        }
        else if (frame instanceof PongWebSocketFrame) {
            out.add(Message.pong());
        }
        else if (frame instanceof BinaryWebSocketFrame) {
            log.warn("Channel({}) drop binary frame, only text frames are supported", ctx.channel());
        }
        else {
            // Close / Ping / Continuation
            out.add(frame.retain());
        }
    }

}
