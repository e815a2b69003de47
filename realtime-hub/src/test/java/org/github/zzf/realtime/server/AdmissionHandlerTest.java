package org.github.zzf.realtime.server;

import static io.netty.handler.codec.http.HttpMethod.GET;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.BDDAssertions.then;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import org.github.zzf.realtime.protocol.server.Hub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AdmissionHandlerTest {

    Hub hub;
    EmbeddedChannel channel;

    @BeforeEach
    void beforeEach() {
        hub = mock(Hub.class);
        channel = new EmbeddedChannel(new AdmissionHandler("/ws", "/health", "valid-token"::equals, hub));
    }

    private FullHttpResponse request(String uri) {
        channel.writeInbound(new DefaultFullHttpRequest(HTTP_1_1, GET, uri));
        return channel.readOutbound();
    }

    @Test
    void givenValidRequest_whenAdmit_thenForwardedAndHandlerRemoved() {
        channel.writeInbound(new DefaultFullHttpRequest(HTTP_1_1, GET, "/ws?client_id=c1&token=valid-token"));

        FullHttpRequest forwarded = channel.readInbound();
        then(forwarded.uri()).isEqualTo("/ws?client_id=c1&token=valid-token");
        forwarded.release();
        then(channel.attr(AdmissionHandler.CLIENT_ID).get()).isEqualTo("c1");
        then(channel.pipeline().get(AdmissionHandler.class)).isNull();
        then(channel.isOpen()).isTrue();
    }

    @Test
    void givenMissingClientId_whenAdmit_thenBadRequestAndClosed() {
        FullHttpResponse resp = request("/ws?token=valid-token");

        then(resp.status().code()).isEqualTo(400);
        resp.release();
        then(channel.isOpen()).isFalse();
        then((Object) channel.readInbound()).isNull();
    }

    @Test
    void givenInvalidToken_whenAdmit_thenUnauthorized() {
        FullHttpResponse resp = request("/ws?client_id=c1&token=forged");

        then(resp.status().code()).isEqualTo(401);
        resp.release();
        then(channel.isOpen()).isFalse();
        then(channel.attr(AdmissionHandler.CLIENT_ID).get()).isNull();
    }

    @Test
    void givenMissingToken_whenAdmit_thenUnauthorized() {
        FullHttpResponse resp = request("/ws?client_id=c1");

        then(resp.status().code()).isEqualTo(401);
        resp.release();
    }

    @Test
    void givenUnknownPath_whenAdmit_thenNotFound() {
        FullHttpResponse resp = request("/admin?client_id=c1&token=valid-token");

        then(resp.status().code()).isEqualTo(404);
        resp.release();
    }

    @Test
    void givenRunningHub_whenHealth_thenOk() {
        given(hub.isRunning()).willReturn(true);

        FullHttpResponse resp = request("/health");

        then(resp.status().code()).isEqualTo(200);
        then(resp.content().toString(UTF_8)).isEqualTo("WebSocket server is running");
        resp.release();
    }

    @Test
    void givenStoppedHub_whenHealth_thenServiceUnavailable() {
        given(hub.isRunning()).willReturn(false);

        FullHttpResponse resp = request("/health");

        then(resp.status().code()).isEqualTo(503);
        resp.release();
    }

}
