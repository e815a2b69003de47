package org.github.zzf.realtime.server.codec.websocket;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.ssl.SslContext;
import lombok.Builder;
import org.github.zzf.realtime.protocol.codec.MessageCodec;
import org.github.zzf.realtime.protocol.codec.WebSocketMessageCodec;
import org.github.zzf.realtime.protocol.server.Authenticator;
import org.github.zzf.realtime.protocol.server.Hub;
import org.github.zzf.realtime.protocol.server.MessageHandler;
import org.github.zzf.realtime.server.AdmissionHandler;
import org.github.zzf.realtime.server.DefaultServerSessionHandler;
import org.github.zzf.realtime.server.FrameActivityHandler;

/**
 * ws / wss pipeline, sslContext is null for plain ws
 */
@Builder
public class HubOverWebsocketServerInitializer extends ChannelInitializer<SocketChannel> {

    public static final String ADMISSION_HANDLER = "admissionHandler";

    private final String websocketPath;
    private final String healthPath;
    private final SslContext sslContext;
    private final Hub hub;
    private final Authenticator authenticator;
    private final MessageHandler messageHandler;
    private final MessageCodec codec;
    private final int maxFramePayloadLength;
    private final int outboundCapacity;

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();
        if (sslContext != null) {
            pipeline.addLast(sslContext.newHandler(ch.alloc()));
        }
        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
            .websocketPath(websocketPath)
            // the upgrade request carries client_id / token in the query string
            .checkStartsWith(true)
            .allowExtensions(true)
            .maxFramePayloadLength(maxFramePayloadLength)
            .dropPongFrames(false)
            .build();
        pipeline
            // http handler
            .addLast(new HttpServerCodec())
            .addLast(new HttpObjectAggregator(65536))
            .addLast(ADMISSION_HANDLER, new AdmissionHandler(websocketPath, healthPath, authenticator, hub))
            // websocket handler
            .addLast(new WebSocketServerCompressionHandler())
            // every frame refreshes the session's liveness, control frames included
            .addLast(FrameActivityHandler.INSTANCE)
            .addLast(new WebSocketServerProtocolHandler(wsConfig))
            // inbound:     TextWebSocketFrame -> Message
            // outbound:    Message -> TextWebSocketFrame
            .addLast(new WebSocketMessageCodec(codec))
            .addLast(DefaultServerSessionHandler.HANDLER_NAME,
                new DefaultServerSessionHandler(hub, messageHandler, outboundCapacity))
        ;
    }

}
