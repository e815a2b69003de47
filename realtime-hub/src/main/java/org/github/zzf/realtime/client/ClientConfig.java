package org.github.zzf.realtime.client;

import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.QueryStringEncoder;
import java.net.URI;
import java.net.URISyntaxException;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ClientConfig {

    @Builder.Default
    String url = "ws://localhost:8080/ws";
    @Builder.Default
    long reconnectInterval = 5000;
    @Builder.Default
    int maxReconnectAttempts = 5;
    @Builder.Default
    long heartbeatInterval = 30000;
    /* connect and handshake timeout */
    @Builder.Default
    long timeout = 10000;
    @Builder.Default
    boolean autoReconnect = true;
    /* sent as the client_id / token query parameters when present */
    String clientId;
    String token;
    @Builder.Default
    int maxPendingMessages = 1000;
    @Builder.Default
    boolean resubscribeOnReconnect = true;

    public static ClientConfig defaults() {
        return ClientConfig.builder().build();
    }

    /**
     * the url with client_id / token merged into its query, they replace the same parameters of the url
     */
    public URI uri() {
        QueryStringDecoder decoder = new QueryStringDecoder(url);
        QueryStringEncoder encoder = new QueryStringEncoder(decoder.path());
        decoder.parameters().forEach((name, values) -> {
            if (("client_id".equals(name) && clientId != null) || ("token".equals(name) && token != null)) {
                return;
            }
            values.forEach(v -> encoder.addParam(name, v));
        });
        if (clientId != null) {
            encoder.addParam("client_id", clientId);
        }
        if (token != null) {
            encoder.addParam("token", token);
        }
        try {
            return encoder.toUri();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("illegal url: " + url, e);
        }
    }

    /**
     * linear backoff capped at 3 intervals
     *
     * @param attempt 1 based
     */
    public long reconnectDelayMillis(int attempt) {
        return reconnectInterval * Math.min(attempt, 3);
    }

}
