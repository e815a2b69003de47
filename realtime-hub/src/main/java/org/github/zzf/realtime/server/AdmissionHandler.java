package org.github.zzf.realtime.server;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;
import static io.netty.handler.codec.http.HttpResponseStatus.SERVICE_UNAVAILABLE;
import static io.netty.handler.codec.http.HttpResponseStatus.UNAUTHORIZED;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static java.nio.charset.StandardCharsets.UTF_8;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCountUtil;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.server.Authenticator;
import org.github.zzf.realtime.protocol.server.Hub;
import org.github.zzf.realtime.server.metric.MetricUtil;

/**
 * gate in front of the WebSocket upgrade.
 * <pre>
 *     GET {healthPath}                                  -> 200 / 503
 *     GET {websocketPath}?client_id=..&amp;token=..     -> upgrade
 *     missing client_id -> 400, bad token -> 401, other path -> 404
 * </pre>
 * <p>Removes itself from the pipeline once the request is admitted.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class AdmissionHandler extends ChannelInboundHandlerAdapter {

    public static final AttributeKey<String> CLIENT_ID = AttributeKey.valueOf("realtime.clientIdentifier");
    public static final String P_CLIENT_ID = "client_id";
    public static final String P_TOKEN = "token";
    public static final String METRIC_REJECTED = "realtime.hub.admission.rejected";

    private final String websocketPath;
    private final String healthPath;
    private final Authenticator authenticator;
    private final Hub hub;

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof FullHttpRequest req)) {
            ctx.fireChannelRead(msg);
            return;
        }
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        String path = query.path();
        if (path.equals(healthPath)) {
            ReferenceCountUtil.release(req);
            health(ctx);
            return;
        }
        if (!path.equals(websocketPath)) {
            ReferenceCountUtil.release(req);
            reject(ctx, NOT_FOUND, "unknown_path");
            return;
        }
        String clientIdentifier = param(query, P_CLIENT_ID);
        if (clientIdentifier == null || clientIdentifier.isBlank()) {
            ReferenceCountUtil.release(req);
            reject(ctx, BAD_REQUEST, "missing_client_id");
            return;
        }
        String token = param(query, P_TOKEN);
        if (token == null || !authenticator.authenticate(token)) {
            ReferenceCountUtil.release(req);
            log.info("Client({}) authenticate failed -> channel: {}", clientIdentifier, ctx.channel());
            reject(ctx, UNAUTHORIZED, "invalid_token");
            return;
        }
        ctx.channel().attr(CLIENT_ID).set(clientIdentifier);
        log.debug("Client({}) admitted -> channel: {}", clientIdentifier, ctx.channel());
        ctx.pipeline().remove(this);
        ctx.fireChannelRead(req);
    }

    private void health(ChannelHandlerContext ctx) {
        if (hub.isRunning()) {
            respond(ctx, OK, "WebSocket server is running");
        }
        else {
            respond(ctx, SERVICE_UNAVAILABLE, "WebSocket server is not running");
        }
    }

    private void reject(ChannelHandlerContext ctx, HttpResponseStatus status, String reason) {
        log.info("Channel({}) rejected -> {} {}", ctx.channel(), status.code(), reason);
        MetricUtil.count(METRIC_REJECTED, "reason", reason);
        respond(ctx, status, reason);
    }

    private static void respond(ChannelHandlerContext ctx, HttpResponseStatus status, String body) {
        FullHttpResponse resp = new DefaultFullHttpResponse(HTTP_1_1, status,
            Unpooled.copiedBuffer(body, UTF_8));
        resp.headers()
            .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN)
            .set(HttpHeaderNames.CONTENT_LENGTH, resp.content().readableBytes())
            .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }

    private static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

}
