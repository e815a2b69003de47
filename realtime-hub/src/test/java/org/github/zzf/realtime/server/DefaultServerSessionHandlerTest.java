package org.github.zzf.realtime.server;

import static org.assertj.core.api.BDDAssertions.then;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.github.zzf.realtime.protocol.codec.MessageCodec;
import org.github.zzf.realtime.protocol.codec.WebSocketMessageCodec;
import org.github.zzf.realtime.protocol.model.AgentStatusPayload;
import org.github.zzf.realtime.protocol.model.Message;
import org.github.zzf.realtime.protocol.model.MessageKind;
import org.github.zzf.realtime.protocol.server.Hub;
import org.github.zzf.realtime.protocol.server.MessageHandler;
import org.github.zzf.realtime.protocol.server.ServerSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultServerSessionHandlerTest {

    Hub hub;
    MessageHandler messageHandler;
    DefaultServerSessionHandler handler;
    EmbeddedChannel channel;

    @BeforeEach
    void beforeEach() {
        hub = mock(Hub.class);
        given(hub.register(any())).willReturn(ImmediateEventExecutor.INSTANCE.newSucceededFuture(null));
        given(hub.unregister(any())).willReturn(ImmediateEventExecutor.INSTANCE.newSucceededFuture(true));
        messageHandler = mock(MessageHandler.class);
        handler = new DefaultServerSessionHandler(hub, messageHandler, 16);
        channel = new EmbeddedChannel();
        channel.pipeline().addLast(DefaultServerSessionHandler.HANDLER_NAME, handler);
    }

    private ServerSession establish(String clientIdentifier) {
        channel.attr(AdmissionHandler.CLIENT_ID).set(clientIdentifier);
        handler.establish(channel.pipeline().context(handler));
        return handler.session();
    }

    @Test
    void givenHandshake_whenEstablish_thenSessionRegistered() {
        ServerSession session = establish("c1");

        then(session.clientIdentifier()).isEqualTo("c1");
        then(session.state()).isEqualTo(ServerSession.SessionState.OPEN);
        verify(hub).register(session);
    }

    @Test
    void givenNoClientIdentifier_whenEstablish_thenChannelClosed() {
        handler.establish(channel.pipeline().context(handler));

        then(handler.session()).isNull();
        then(channel.isOpen()).isFalse();
        verifyNoInteractions(hub);
    }

    @Test
    void givenSubscribeAndUnsubscribe_whenRead_thenTopicsMutated() {
        ServerSession session = establish("c1");

        channel.writeInbound(Message.subscribe("42"));
        channel.writeInbound(Message.subscribe("7"));
        channel.writeInbound(Message.unsubscribe("7"));

        then(session.topics()).containsExactly("42");
        verifyNoInteractions(messageHandler);
    }

    @Test
    void givenHeartbeatAndPong_whenRead_thenOnlyLiveness() {
        establish("c1");

        channel.writeInbound(Message.heartbeat());
        channel.writeInbound(Message.pong());

        verifyNoInteractions(messageHandler);
        then(channel.isActive()).isTrue();
    }

    @Test
    void givenPing_whenRead_thenPongQueued() {
        establish("c1");

        channel.writeInbound(Message.ping());
        channel.runPendingTasks();

        Message pong = channel.readOutbound();
        then(pong.kind()).isEqualTo(MessageKind.PONG);
    }

    @Test
    void givenNonControlMessage_whenRead_thenMessageHandler() {
        establish("c1");
        Message m = Message.agentStatus(AgentStatusPayload.builder().agentId("42").status("running").build());

        channel.writeInbound(m);

        verify(messageHandler).onMessage("c1", m);
    }

    @Test
    void givenFailingMessageHandler_whenRead_thenSessionKept() {
        ServerSession session = establish("c1");
        willThrow(new IllegalStateException("boom")).given(messageHandler).onMessage(anyString(), any());

        channel.writeInbound(Message.agentStatus(AgentStatusPayload.builder().agentId("42").build()));

        then(channel.isActive()).isTrue();
        then(session.isActive()).isTrue();
    }

    @Test
    void givenMessageBeforeHandshake_whenRead_thenDropped() {
        channel.writeInbound(Message.agentStatus(AgentStatusPayload.builder().agentId("42").build()));

        verify(messageHandler, never()).onMessage(anyString(), any());
    }

    @Test
    void givenException_whenCaught_thenSessionClosed() {
        ServerSession session = establish("c1");

        channel.pipeline().fireExceptionCaught(new IllegalStateException("corrupted frame"));

        then(channel.isOpen()).isFalse();
        then(session.state()).isEqualTo(ServerSession.SessionState.CLOSED);
        verify(hub).unregister(session);
    }

    @Test
    void givenFramesThatNeverDecode_whenRead_thenLivenessRefreshed() throws InterruptedException {
        channel.pipeline().addFirst(new WebSocketMessageCodec(new MessageCodec()));
        channel.pipeline().addFirst(FrameActivityHandler.INSTANCE);
        ServerSession session = establish("c1");

        long before = session.lastActive();
        Thread.sleep(5);
        channel.writeInbound(new TextWebSocketFrame("{\"type\":\"custom_app\",\"payload\":{}}"));
        long afterUnknown = session.lastActive();
        Thread.sleep(5);
        channel.writeInbound(new TextWebSocketFrame("{not json"));
        long afterMalformed = session.lastActive();
        Thread.sleep(5);
        channel.writeInbound(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(new byte[]{1, 2, 3})));
        long afterBinary = session.lastActive();

        then(afterUnknown).isGreaterThan(before);
        then(afterMalformed).isGreaterThan(afterUnknown);
        then(afterBinary).isGreaterThan(afterMalformed);
        then(channel.isActive()).isTrue();
        verifyNoInteractions(messageHandler);
    }

}
