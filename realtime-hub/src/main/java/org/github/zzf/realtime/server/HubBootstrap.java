package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import javax.net.ssl.SSLException;
import lombok.Builder;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.codec.MessageCodec;
import org.github.zzf.realtime.protocol.server.Authenticator;
import org.github.zzf.realtime.protocol.server.Hub;
import org.github.zzf.realtime.protocol.server.MessageHandler;
import org.github.zzf.realtime.server.codec.websocket.HubOverWebsocketServerInitializer;

@Slf4j
@Builder
public class HubBootstrap {

    private final AtomicReference<Channel> listened = new AtomicReference<>();
    private final AtomicReference<DefaultHub> hubRef = new AtomicReference<>();

    Authenticator authenticator;
    MessageHandler messageHandler;
    /* ws://host:port/path or wss://host:port/path, port 0 picks a free port */
    @Builder.Default
    String serverListenedAddress = "ws://0.0.0.0:8080/ws";
    @Builder.Default
    int workerThreadNum = Runtime.getRuntime().availableProcessors() * 2;
    @Builder.Default
    String healthPath = "/health";
    @Builder.Default
    int maxFramePayloadLength = 65536;
    @Builder.Default
    int outboundCapacity = 256;
    @Builder.Default
    long heartbeatIntervalMillis = 30_000;
    @Builder.Default
    long heartbeatPingMillis = 30_000;
    @Builder.Default
    long heartbeatTimeoutMillis = 60_000;
    @Builder.Default
    Set<String> applicationTypes = Collections.emptySet();
    @Builder.Default
    boolean shutdownHook = true;

    @SneakyThrows
    public HubBootstrap start() {
        checkNotNull(authenticator, "authenticator");
        checkNotNull(messageHandler, "messageHandler");
        URI uri = new URI(serverListenedAddress.trim());
        String websocketPath = uri.getPath() == null || uri.getPath().isEmpty() ? "/ws" : uri.getPath();
        InetSocketAddress bindAddress = new InetSocketAddress(uri.getHost(), uri.getPort() < 0 ? 8080 : uri.getPort());
        SslContext sslContext = switch (uri.getScheme()) {
            case "ws" -> null;
            case "wss" -> sslContext();
            default -> throw new UnsupportedOperationException("Unsupported Schema: " + uri.getScheme());
        };
        DefaultHub hub = new DefaultHub(heartbeatIntervalMillis, heartbeatPingMillis, heartbeatTimeoutMillis);
        hubRef.set(hub);
        HubOverWebsocketServerInitializer initializer = HubOverWebsocketServerInitializer.builder()
            .websocketPath(websocketPath)
            .healthPath(healthPath)
            .sslContext(sslContext)
            .hub(hub)
            .authenticator(authenticator)
            .messageHandler(messageHandler)
            .codec(new MessageCodec(applicationTypes))
            .maxFramePayloadLength(maxFramePayloadLength)
            .outboundCapacity(outboundCapacity)
            .build();
        try {
            listened.set(listen(bindAddress, initializer, uri.getScheme()));
        } catch (RuntimeException e) {
            hub.close();
            throw e;
        }
        if (shutdownHook) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::close, "hub-shutdown-hook"));
        }
        return this;
    }

    private Channel listen(InetSocketAddress address, HubOverWebsocketServerInitializer initializer, String scheme) {
        NioEventLoopGroup bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory(scheme + "-boss"));
        NioEventLoopGroup workerGroup = new NioEventLoopGroup(workerThreadNum,
            new DefaultThreadFactory(scheme + "-worker"));
        try {
            Channel channel = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .childHandler(initializer)
                .bind(address).sync()
                .channel();
            log.info("Realtime hub({}) server listened at {}", scheme, channel.localAddress());
            channel.closeFuture().addListener(f -> {
                bossGroup.shutdownGracefully();
                workerGroup.shutdownGracefully();
                log.info("Realtime hub({}) server was shutdown.", scheme);
            });
            return channel;
        } catch (Exception e) {
            log.error("Realtime hub({}) server bind {} failed.", scheme, address, e);
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new RuntimeException(e);
        }
    }

    private static SslContext sslContext() throws SSLException {
        String certPath = System.getProperty("realtime.server.ssl.cert", "cert/server.pem");
        String keyPath = System.getProperty("realtime.server.ssl.key", "cert/server.pkcs8.key");
        return SslContextBuilder.forServer(
                ClassLoader.getSystemResourceAsStream(certPath),
                ClassLoader.getSystemResourceAsStream(keyPath))
            .build();
    }

    public InetSocketAddress localAddress() {
        Channel channel = checkNotNull(listened.get(), "not started");
        return (InetSocketAddress) channel.localAddress();
    }

    public Hub hub() {
        return checkNotNull(hubRef.get(), "not started");
    }

    /**
     * stop accepting connections, then close every session
     */
    public void close() {
        Channel channel = listened.getAndSet(null);
        if (channel != null) {
            log.info("Shutdown Server... -> {}", channel);
            channel.close().awaitUninterruptibly();
        }
        DefaultHub hub = hubRef.get();
        if (hub != null) {
            hub.close();
        }
    }

}
