package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.github.zzf.realtime.server.DefaultServerSessionHandler.LOG_ON_FAILURE;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Message;
import org.github.zzf.realtime.protocol.server.Hub;
import org.github.zzf.realtime.protocol.server.ServerSession;
import org.github.zzf.realtime.server.metric.MetricUtil;

/**
 * one WebSocket connection.
 * <p>Inbound frames are handled by {@link DefaultServerSessionHandler}, outbound messages go through a bounded
 * queue drained on the channel's event loop.</p>
 */
@Slf4j
public class DefaultServerSession implements ServerSession {

    public static final String METRIC_MESSAGE = "realtime.hub.message";

    private final String id = UUID.randomUUID().toString();
    private final String clientIdentifier;
    private final Channel channel;
    private final Hub hub;

    private final BlockingQueue<Message> outQueue;
    private final Set<String> topics = ConcurrentHashMap.newKeySet();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final AtomicBoolean outboundClosed = new AtomicBoolean(false);
    private volatile long lastActive;

    private final ChannelFutureListener CLOSE_ON_WRITE_FAILURE = future -> {
        if (!future.isSuccess()) {
            log.error("Client({}) write failed, now close the session", cId(), future.cause());
            close();
        }
    };

    public DefaultServerSession(String clientIdentifier, Channel channel, Hub hub, int outboundCapacity) {
        checkArgument(outboundCapacity > 0, "outboundCapacity");
        this.clientIdentifier = checkNotNull(clientIdentifier, "clientIdentifier");
        this.channel = checkNotNull(channel, "channel");
        this.hub = checkNotNull(hub, "hub");
        this.outQueue = new ArrayBlockingQueue<>(outboundCapacity);
        this.lastActive = System.currentTimeMillis();
        channel.closeFuture().addListener(f -> onChannelClosed());
    }

    /**
     * the handshake is done, hand the session to the hub
     */
    void established() {
        if (!state.compareAndSet(SessionState.CONNECTING, SessionState.OPEN)) {
            return;
        }
        hub.register(this).addListener(f -> {
            if (!f.isSuccess()) {
                log.error("Client({}) register failed, now close the session", cId(), f.cause());
                close();
            }
        });
    }

    private void onChannelClosed() {
        state.set(SessionState.CLOSED);
        outboundClosed.set(true);
        outQueue.clear();
        log.info("Client({}) channel closed -> session: {}", cId(), id);
        // no-op if the hub already removed it
        hub.unregister(this).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("Client({}) unregister after close failed: {}", cId(), f.cause().getMessage());
            }
        });
    }

    @Override
    public boolean offer(Message message) {
        if (outboundClosed.get()) {
            MetricUtil.count(METRIC_MESSAGE, "result", "dropped");
            return false;
        }
        if (!outQueue.offer(message)) {
            log.warn("Client({}) outbound queue is full, drop message -> {}", cId(), message);
            MetricUtil.count(METRIC_MESSAGE, "result", "dropped");
            return false;
        }
        MetricUtil.count(METRIC_MESSAGE, "result", "delivered");
        scheduleDrain();
        return true;
    }

    void resumeDrain() {
        if (!outQueue.isEmpty()) {
            scheduleDrain();
        }
    }

    private void scheduleDrain() {
        if (drainScheduled.compareAndSet(false, true)) {
            channel.eventLoop().execute(this::drain);
        }
    }

    private void drain() {
        drainScheduled.set(false);
        int written = 0;
        Message message;
        while (!outboundClosed.get() && channel.isWritable() && (message = outQueue.poll()) != null) {
            channel.write(message).addListener(CLOSE_ON_WRITE_FAILURE);
            written += 1;
        }
        if (written > 0) {
            channel.flush();
            log.debug("Client({}) flushed {} messages", cId(), written);
        }
        // paused until the channel becomes writable again
    }

    @Override
    public void closeOutbound() {
        if (!outboundClosed.compareAndSet(false, true)) {
            return;
        }
        outQueue.clear();
        state.compareAndSet(SessionState.OPEN, SessionState.CLOSING);
        state.compareAndSet(SessionState.CONNECTING, SessionState.CLOSING);
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                .addListener(ChannelFutureListener.CLOSE);
        }
        else {
            channel.close();
        }
    }

    @Override
    public void ping() {
        if (!isActive()) {
            return;
        }
        channel.writeAndFlush(new PingWebSocketFrame()).addListener(LOG_ON_FAILURE);
    }

    @Override
    public void close() {
        SessionState s = state.get();
        if (s == SessionState.CLOSED) {
            return;
        }
        state.compareAndSet(s, SessionState.CLOSING);
        channel.close();
    }

    void touch() {
        lastActive = System.currentTimeMillis();
    }

    void subscribe(String topic) {
        if (topics.add(topic)) {
            log.info("Client({}) subscribed -> topic: {}", cId(), topic);
        }
    }

    void unsubscribe(String topic) {
        if (topics.remove(topic)) {
            log.info("Client({}) unsubscribed -> topic: {}", cId(), topic);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String clientIdentifier() {
        return clientIdentifier;
    }

    @Override
    public SessionState state() {
        return state.get();
    }

    @Override
    public Set<String> topics() {
        return Set.copyOf(topics);
    }

    @Override
    public long lastActive() {
        return lastActive;
    }

    @Override
    public boolean isActive() {
        return channel.isActive() && state.get() != SessionState.CLOSED;
    }

    Channel channel() {
        return channel;
    }

    private String cId() {
        return clientIdentifier;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"id\":\"").append(id).append('\"').append(',');
        sb.append("\"clientIdentifier\":\"").append(clientIdentifier).append('\"').append(',');
        sb.append("\"state\":\"").append(state.get()).append('\"').append(',');
        sb.append("\"topics\":\"").append(topics).append('\"').append(',');
        sb.append("\"lastActive\":").append(lastActive).append(',');
        sb.append("\"queued\":").append(outQueue.size()).append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
