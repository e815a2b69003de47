package org.github.zzf.realtime.client;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.client.transport.Connection;
import org.github.zzf.realtime.client.transport.ConnectionListener;
import org.github.zzf.realtime.client.transport.Connector;
import org.github.zzf.realtime.protocol.codec.MessageCodec;
import org.github.zzf.realtime.protocol.model.Message;

/**
 * <pre>
 *     IDLE -> CONNECTING -> OPEN -> RECONNECTING -> CONNECTING -> ...
 *                                                \-> CLOSED (attempts exhausted / autoReconnect off)
 *     any  -> close() -> CLOSED
 * </pre>
 * <p>Every field below the executor is confined to the client's event loop. Timers and transport callbacks carry
 * the generation they were created for and do nothing once it changed.</p>
 */
@Slf4j
public class ReconnectClient implements Client {

    public static final int CLOSE_NORMAL = 1000;

    private static final ClientListener NOOP = new ClientListener() {
    };

    private final ClientConfig config;
    private final Connector connector;
    private final MessageCodec codec = new MessageCodec();
    private final EventExecutor eventLoop;
    private final boolean exclusiveLoop;

    private final PendingQueue pending;
    private final Set<String> subscriptions = new LinkedHashSet<>();
    private ClientListener listener = NOOP;
    private volatile ConnectionState state = ConnectionState.IDLE;
    private Connection connection;
    private int attempts;
    private long generation;
    private ScheduledFuture<?> heartbeatTimer;
    private ScheduledFuture<?> reconnectTimer;

    public ReconnectClient(ClientConfig config, Connector connector) {
        this(config, connector, null);
    }

    /**
     * @param eventLoop the executor that serializes every state change, an exclusive one is created if null
     */
    public ReconnectClient(ClientConfig config, Connector connector, EventExecutor eventLoop) {
        this.config = checkNotNull(config, "config");
        this.connector = checkNotNull(connector, "connector");
        this.pending = new PendingQueue(config.getMaxPendingMessages());
        if (eventLoop == null) {
            this.eventLoop = new DefaultEventExecutor(new DefaultThreadFactory("realtime-client", true));
            this.exclusiveLoop = true;
        }
        else {
            this.eventLoop = eventLoop;
            this.exclusiveLoop = false;
        }
    }

    @Override
    public ConnectionState connect(ClientListener listener) {
        return inLoop(() -> {
            if (listener != null) {
                this.listener = listener;
            }
            if (state == ConnectionState.OPEN || state == ConnectionState.CONNECTING) {
                log.warn("Client({}) connect ignored, already {}", cId(), state);
                return state;
            }
            cancelReconnectTimer();
            doConnect();
            return state;
        }, ConnectionState.CLOSED);
    }

    private void doConnect() {
        long gen = ++generation;
        state = ConnectionState.CONNECTING;
        log.info("Client({}) connecting -> url: {}, attempt: {}", cId(), config.getUrl(), attempts);
        try {
            connector.connect(config.uri(), Duration.ofMillis(config.getTimeout()), new AttemptListener(gen));
        } catch (RuntimeException e) {
            log.error("Client({}) connect failed", cId(), e);
            notifyListener("onError", () -> listener.onError(e));
            handleClose(1006, e.getMessage());
        }
    }

    private void handleOpen(Connection conn) {
        connection = conn;
        state = ConnectionState.OPEN;
        attempts = 0;
        log.info("Client({}) connected -> url: {}", cId(), config.getUrl());
        startHeartbeat();
        if (config.isResubscribeOnReconnect()) {
            resubscribe();
        }
        flush();
        notifyListener("onOpen", () -> listener.onOpen());
    }

    private void resubscribe() {
        List<String> topics = new ArrayList<>(subscriptions);
        // priority entries go to the front, add the newest first so the flush keeps subscription order
        for (int i = topics.size() - 1; i >= 0; i--) {
            String topic = topics.get(i);
            String key = subscribeKey(topic);
            if (!pending.containsKey(key)) {
                pending.add(codec.encode(Message.subscribe(topic)), true, key);
            }
        }
    }

    private void flush() {
        int flushed = 0;
        PendingQueue.Entry e;
        while (connection != null && connection.isOpen() && (e = pending.poll()) != null) {
            if (!connection.send(e.text)) {
                pending.addFirst(e);
                break;
            }
            flushed += 1;
        }
        if (flushed > 0) {
            log.info("Client({}) flushed {} pending messages, left: {}", cId(), flushed, pending.size());
        }
    }

    private void handleText(String text) {
        Object message = text;
        try {
            Object parsed = JSON.parse(text);
            if (parsed instanceof JSONObject) {
                message = parsed;
            }
        } catch (RuntimeException e) {
            log.debug("Client({}) received non JSON text: {}", cId(), text);
        }
        Object m = message;
        notifyListener("onMessage", () -> listener.onMessage(m));
    }

    private void handleClose(int code, String reason) {
        stopHeartbeat();
        connection = null;
        log.info("Client({}) connection closed -> code: {}, reason: {}", cId(), code, reason);
        if (config.isAutoReconnect() && attempts < config.getMaxReconnectAttempts()) {
            attempts += 1;
            long delay = config.reconnectDelayMillis(attempts);
            state = ConnectionState.RECONNECTING;
            long gen = generation;
            log.info("Client({}) reconnect in {}ms -> attempt: {}/{}", cId(), delay, attempts,
                config.getMaxReconnectAttempts());
            reconnectTimer = eventLoop.schedule(() -> {
                if (gen != generation || state != ConnectionState.RECONNECTING) {
                    return;
                }
                reconnectTimer = null;
                doConnect();
            }, delay, TimeUnit.MILLISECONDS);
        }
        else {
            state = ConnectionState.CLOSED;
            if (config.isAutoReconnect()) {
                log.warn("Client({}) gave up after {} reconnect attempts", cId(), attempts);
            }
            notifyListener("onClose", () -> listener.onClose(code, reason));
        }
    }

    private void startHeartbeat() {
        stopHeartbeat();
        long interval = config.getHeartbeatInterval();
        if (interval <= 0) {
            return;
        }
        HeartbeatTask task = new HeartbeatTask(generation);
        task.future = eventLoop.scheduleAtFixedRate(task, interval, interval, TimeUnit.MILLISECONDS);
        heartbeatTimer = task.future;
    }

    private void stopHeartbeat() {
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel(false);
            heartbeatTimer = null;
        }
    }

    private void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    @Override
    public boolean send(Message message, boolean priority) {
        checkNotNull(message, "message");
        return send(codec.encode(message), priority);
    }

    @Override
    public boolean send(String text, boolean priority) {
        checkNotNull(text, "text");
        return inLoop(() -> doSend(text, priority, null), false);
    }

    private boolean doSend(String text, boolean priority, String key) {
        if (state == ConnectionState.OPEN && connection != null && connection.isOpen()) {
            if (connection.send(text)) {
                return true;
            }
            log.warn("Client({}) write refused, queue it", cId());
        }
        PendingQueue.Entry dropped = pending.add(text, priority, key);
        if (dropped != null) {
            log.warn("Client({}) pending queue is full({}), drop -> {}", cId(), config.getMaxPendingMessages(),
                dropped);
        }
        log.debug("Client({}) not connected, message queued -> pending: {}", cId(), pending.size());
        return false;
    }

    @Override
    public void subscribe(String topic) {
        checkArgument(topic != null && !topic.isEmpty(), "topic");
        inLoop(() -> {
            subscriptions.add(topic);
            dropQueued(unsubscribeKey(topic));
            String key = subscribeKey(topic);
            if (state != ConnectionState.OPEN && pending.containsKey(key)) {
                return null;
            }
            doSend(codec.encode(Message.subscribe(topic)), true, key);
            return null;
        }, null);
    }

    @Override
    public void unsubscribe(String topic) {
        checkArgument(topic != null && !topic.isEmpty(), "topic");
        inLoop(() -> {
            subscriptions.remove(topic);
            dropQueued(subscribeKey(topic));
            String key = unsubscribeKey(topic);
            if (state != ConnectionState.OPEN && pending.containsKey(key)) {
                return null;
            }
            doSend(codec.encode(Message.unsubscribe(topic)), true, key);
            return null;
        }, null);
    }

    /**
     * a queued subscribe / unsubscribe is superseded by the opposite call, only the last one is flushed
     */
    private void dropQueued(String key) {
        int removed = pending.removeKey(key);
        if (removed > 0) {
            log.debug("Client({}) superseded queued control message dropped -> {}", cId(), key);
        }
    }

    private static String subscribeKey(String topic) {
        return "subscribe:" + topic;
    }

    private static String unsubscribeKey(String topic) {
        return "unsubscribe:" + topic;
    }

    @Override
    public Set<String> subscriptions() {
        return inLoop(() -> Collections.unmodifiableSet(new LinkedHashSet<>(subscriptions)),
            Collections.emptySet());
    }

    @Override
    public ConnectionState state() {
        return state;
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.OPEN;
    }

    @Override
    public int pendingMessages() {
        return inLoop(pending::size, 0);
    }

    @Override
    public void close() {
        inLoop(() -> {
            generation += 1;
            stopHeartbeat();
            cancelReconnectTimer();
            Connection conn = connection;
            connection = null;
            if (conn != null) {
                conn.close();
            }
            attempts = 0;
            int discarded = pending.clear();
            subscriptions.clear();
            ConnectionState previous = state;
            state = ConnectionState.CLOSED;
            log.info("Client({}) closed -> previous state: {}, discarded pending: {}", cId(), previous, discarded);
            if (previous != ConnectionState.CLOSED && previous != ConnectionState.IDLE) {
                notifyListener("onClose", () -> listener.onClose(CLOSE_NORMAL, "closed by client"));
            }
            return null;
        }, null);
    }

    @Override
    public void shutdown() {
        close();
        connector.close();
        if (exclusiveLoop) {
            eventLoop.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    private <T> T inLoop(Supplier<T> task, T ifShutdown) {
        if (eventLoop.inEventLoop()) {
            return task.get();
        }
        if (eventLoop.isShuttingDown()) {
            log.warn("Client({}) event loop is shut down, call ignored", cId());
            return ifShutdown;
        }
        Callable<T> callable = task::get;
        try {
            return eventLoop.submit(callable).syncUninterruptibly().getNow();
        } catch (RejectedExecutionException e) {
            log.warn("Client({}) event loop is shut down, call ignored", cId());
            return ifShutdown;
        }
    }

    private void notifyListener(String event, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Client({}) ClientListener.{} failed", cId(), event, e);
        }
    }

    private String cId() {
        return config.getClientId();
    }

    int attempts() {
        return attempts;
    }

    private class HeartbeatTask implements Runnable {

        private final long gen;
        private ScheduledFuture<?> future;

        HeartbeatTask(long gen) {
            this.gen = gen;
        }

        @Override
        public void run() {
            boolean sent = gen == generation
                && connection != null
                && connection.isOpen()
                && connection.send(codec.encode(Message.heartbeat()));
            if (sent) {
                log.debug("Client({}) heartbeat sent", cId());
                return;
            }
            future.cancel(false);
            if (heartbeatTimer == future) {
                heartbeatTimer = null;
            }
        }

    }

    /**
     * callbacks of one connect attempt, hopped onto the event loop
     */
    private class AttemptListener implements ConnectionListener {

        private final long gen;

        AttemptListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(Connection conn) {
            execute(() -> {
                if (gen != generation) {
                    log.debug("Client({}) stale connection opened, close it", cId());
                    conn.close();
                    return;
                }
                handleOpen(conn);
            });
        }

        @Override
        public void onText(String text) {
            execute(() -> {
                if (gen == generation) {
                    handleText(text);
                }
            });
        }

        @Override
        public void onClose(int code, String reason) {
            execute(() -> {
                if (gen == generation) {
                    handleClose(code, reason);
                }
            });
        }

        @Override
        public void onError(Throwable cause) {
            execute(() -> {
                if (gen != generation) {
                    return;
                }
                log.error("Client({}) transport error: {}", cId(), cause.getMessage());
                notifyListener("onError", () -> listener.onError(cause));
            });
        }

        private void execute(Runnable task) {
            try {
                eventLoop.execute(task);
            } catch (RejectedExecutionException e) {
                log.debug("Client({}) event loop is shut down, transport event ignored", cId());
            }
        }

    }

}
