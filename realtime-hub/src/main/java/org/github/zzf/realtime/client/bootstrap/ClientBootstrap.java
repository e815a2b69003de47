package org.github.zzf.realtime.client.bootstrap;

import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.client.ClientConfig;
import org.github.zzf.realtime.client.ClientListener;
import org.github.zzf.realtime.client.ReconnectClient;
import org.github.zzf.realtime.client.transport.netty.NettyWebSocketConnector;

/**
 * <pre>
 *     java ... ClientBootstrap ws://127.0.0.1:8080/ws client-01 valid-token agent-42 tx-0001
 * </pre>
 */
@Slf4j
public class ClientBootstrap {

    public static void main(String[] args) throws InterruptedException {
        if (args.length < 3) {
            log.error("usage: ClientBootstrap <url> <clientId> <token> [topic...]");
            return;
        }
        ClientConfig config = ClientConfig.builder()
            .url(args[0])
            .clientId(args[1])
            .token(args[2])
            .reconnectInterval(Long.getLong("realtime.client.reconnect.interval.ms", 5000L))
            .maxReconnectAttempts(Integer.getInteger("realtime.client.reconnect.max.attempts", 5))
            .heartbeatInterval(Long.getLong("realtime.client.heartbeat.interval.ms", 30000L))
            .build();
        log.info("ClientBootstrap config: {}", config);
        CountDownLatch closed = new CountDownLatch(1);
        ReconnectClient client = new ReconnectClient(config, new NettyWebSocketConnector());
        Runtime.getRuntime().addShutdownHook(new Thread(client::shutdown, "client-shutdown-hook"));
        Arrays.stream(args, 3, args.length).forEach(client::subscribe);
        client.connect(new ClientListener() {
            @Override
            public void onOpen() {
                log.info("Client({}) open", config.getClientId());
            }

            @Override
            public void onMessage(Object message) {
                log.info("Client({}) received -> {}", config.getClientId(), message);
            }

            @Override
            public void onClose(int code, String reason) {
                log.info("Client({}) closed -> {} {}", config.getClientId(), code, reason);
                closed.countDown();
            }

            @Override
            public void onError(Throwable cause) {
                log.error("Client({}) error: {}", config.getClientId(), cause.getMessage());
            }
        });
        closed.await();
        client.shutdown();
    }

}
