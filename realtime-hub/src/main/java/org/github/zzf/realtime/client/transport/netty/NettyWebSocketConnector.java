package org.github.zzf.realtime.client.transport.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.net.URI;
import java.time.Duration;
import javax.net.ssl.SSLException;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.client.transport.ConnectionListener;
import org.github.zzf.realtime.client.transport.Connector;

/**
 * ws:// and wss:// over Netty
 */
@Slf4j
public class NettyWebSocketConnector implements Connector {

    private final EventLoopGroup group;
    private final boolean exclusiveGroup;
    private final int maxFramePayloadLength;

    public NettyWebSocketConnector() {
        this(new NioEventLoopGroup(1, new DefaultThreadFactory("realtime-client-io", true)), true, 65536);
    }

    /**
     * share an event loop group, the caller shuts it down
     */
    public NettyWebSocketConnector(EventLoopGroup group) {
        this(group, false, 65536);
    }

    private NettyWebSocketConnector(EventLoopGroup group, boolean exclusiveGroup, int maxFramePayloadLength) {
        this.group = group;
        this.exclusiveGroup = exclusiveGroup;
        this.maxFramePayloadLength = maxFramePayloadLength;
    }

    @Override
    public void connect(URI uri, Duration timeout, ConnectionListener listener) {
        WebSocketClientHandler handler = new WebSocketClientHandler(listener);
        String scheme = uri.getScheme();
        if (!"ws".equals(scheme) && !"wss".equals(scheme)) {
            handler.connectFailed(new IllegalArgumentException("Unsupported Schema: " + scheme));
            return;
        }
        boolean secure = "wss".equals(scheme);
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
        SslContext sslCtx;
        try {
            sslCtx = secure ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            handler.connectFailed(e);
            return;
        }
        WebSocketClientProtocolConfig wsConfig = WebSocketClientProtocolConfig.newBuilder()
            .webSocketUri(uri)
            .version(WebSocketVersion.V13)
            .allowExtensions(true)
            .maxFramePayloadLength(maxFramePayloadLength)
            .handshakeTimeoutMillis(timeout.toMillis())
            // close frames are reported to the listener with their status code
            .handleCloseFrames(false)
            .build();
        ChannelFuture future = new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    if (sslCtx != null) {
                        ch.pipeline().addLast(sslCtx.newHandler(ch.alloc(), host, port));
                    }
                    ch.pipeline()
                        .addLast(new HttpClientCodec())
                        .addLast(new HttpObjectAggregator(65536))
                        .addLast(WebSocketClientCompressionHandler.INSTANCE)
                        .addLast(new WebSocketClientProtocolHandler(wsConfig))
                        .addLast(WebSocketClientHandler.HANDLER_NAME, handler)
                    ;
                }
            })
            .connect(host, port);
        future.addListener((ChannelFuture f) -> {
            if (!f.isSuccess()) {
                log.error("connect to {} failed: {}", uri, f.cause().getMessage());
                handler.connectFailed(f.cause());
            }
            else {
                log.debug("connected to {} -> {}", uri, f.channel());
            }
        });
    }

    @Override
    public void close() {
        if (exclusiveGroup) {
            group.shutdownGracefully();
        }
    }

}
