package org.github.zzf.realtime;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.server.Authenticator;
import org.github.zzf.realtime.server.HubBootstrap;
import org.github.zzf.realtime.server.metric.MicroMeterMetrics;

@Slf4j
public class Application {

    public static void main(String[] args) {
        //
        int workerThreadNum = Integer.getInteger("realtime.server.thread.num",
                Runtime.getRuntime().availableProcessors() * 2);
        log.info("realtime.server.thread.num -> {}", workerThreadNum);
        //
        String serverListenedAddress = System.getProperty("realtime.server.listened.address", "ws://0.0.0.0:8080/ws");
        log.info("realtime.server.listened.address: {}", serverListenedAddress);
        //
        HubBootstrap.builder()
                .authenticator(authenticator())
                .messageHandler((clientIdentifier, message) ->
                        log.info("Client({}) message received -> {}", clientIdentifier, message))
                .serverListenedAddress(serverListenedAddress)
                .workerThreadNum(workerThreadNum)
                .healthPath(System.getProperty("realtime.server.health.path", "/health"))
                .maxFramePayloadLength(Integer.getInteger("realtime.server.max.frame.bytes", 65536))
                .applicationTypes(csv(System.getProperty("realtime.server.application.types", "")))
                .outboundCapacity(Integer.getInteger("realtime.hub.outbound.capacity", 256))
                .heartbeatIntervalMillis(Long.getLong("realtime.hub.heartbeat.interval.ms", 30_000L))
                .heartbeatPingMillis(Long.getLong("realtime.hub.heartbeat.ping.ms", 30_000L))
                .heartbeatTimeoutMillis(Long.getLong("realtime.hub.heartbeat.timeout.ms", 60_000L))
                .build()
                .start();
        // metric
        String appName = System.getProperty("appName", "realtime-hub");
        log.info("appName: {}", appName);
        MicroMeterMetrics.builder()
                .appName(appName)
                .prometheusExportAddress(System.getProperty("prometheus.export.address"))
                .build()
                .init();
    }

    private static Authenticator authenticator() {
        Set<String> tokens = csv(System.getProperty("realtime.server.auth.tokens", "valid-token"));
        log.info("realtime.server.auth.tokens: {} tokens", tokens.size());
        return tokens::contains;
    }

    static Set<String> csv(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

}
