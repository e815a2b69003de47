package org.github.zzf.realtime.protocol.codec;

import static org.assertj.core.api.BDDAssertions.then;

import com.alibaba.fastjson.JSON;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import org.github.zzf.realtime.protocol.model.Message;
import org.github.zzf.realtime.protocol.model.MessageKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebSocketMessageCodecTest {

    EmbeddedChannel channel;

    @BeforeEach
    void beforeEach() {
        channel = new EmbeddedChannel(new WebSocketMessageCodec(new MessageCodec()));
    }

    @Test
    void givenTextFrame_whenRead_thenMessage() {
        channel.writeInbound(new TextWebSocketFrame("{\"type\":\"subscribe\",\"topic\":\"agent-42\"}"));

        Message m = channel.readInbound();
        then(m.kind()).isEqualTo(MessageKind.SUBSCRIBE);
        then(m.topic()).isEqualTo("agent-42");
    }

    @Test
    void givenMalformedText_whenRead_thenDroppedAndChannelOpen() {
        channel.writeInbound(new TextWebSocketFrame("{oops"));
        channel.writeInbound(new TextWebSocketFrame("{\"type\":\"heartbeat\"}"));

        Message m = channel.readInbound();
        then(m.kind()).isEqualTo(MessageKind.HEARTBEAT);
        then((Object) channel.readInbound()).isNull();
        then(channel.isActive()).isTrue();
    }

    @Test
    void givenPongFrame_whenRead_thenPongMessage() {
        channel.writeInbound(new PongWebSocketFrame());

        Message m = channel.readInbound();
        then(m.kind()).isEqualTo(MessageKind.PONG);
    }

    @Test
    void givenBinaryFrame_whenRead_thenDropped() {
        channel.writeInbound(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(new byte[]{1, 2, 3})));

        then((Object) channel.readInbound()).isNull();
        then(channel.isActive()).isTrue();
    }

    @Test
    void givenCloseFrame_whenRead_thenPassedThrough() {
        channel.writeInbound(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE));

        CloseWebSocketFrame frame = channel.readInbound();
        then(frame.statusCode()).isEqualTo(1000);
        frame.release();
    }

    @Test
    void givenMessage_whenWrite_thenTextFrame() {
        channel.writeOutbound(Message.ping());

        TextWebSocketFrame frame = channel.readOutbound();
        then(JSON.parseObject(frame.text()).getString("type")).isEqualTo("ping");
        frame.release();
    }

}
