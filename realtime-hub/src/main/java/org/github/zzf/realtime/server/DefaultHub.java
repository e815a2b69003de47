package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ImmediateEventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.AgentStatusPayload;
import org.github.zzf.realtime.protocol.model.Message;
import org.github.zzf.realtime.protocol.model.TransactionPayload;
import org.github.zzf.realtime.protocol.server.Hub;
import org.github.zzf.realtime.protocol.server.ServerSession;
import org.github.zzf.realtime.server.metric.MetricUtil;

/**
 * <pre>
 *     hub-control:     owns the registry, every request is a task on this loop
 *     hub-heartbeat:   periodic sweep, works on a snapshot of the registry
 * </pre>
 */
@Slf4j
public class DefaultHub implements Hub {

    public static final String METRIC_SESSIONS = "realtime.hub.sessions";
    public static final String METRIC_EVICTED = "realtime.hub.session.evicted";

    /**
     * touched only by {@link #controlLoop}
     */
    private final Map<String, ServerSession> registry = new HashMap<>();

    private final DefaultEventExecutor controlLoop;
    private final DefaultEventExecutor heartbeatLoop;
    private final ScheduledFuture<?> heartbeatTask;
    private final long pingAfterMillis;
    private final long timeoutMillis;
    private final LongSupplier clock;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public DefaultHub() {
        this(30_000, 30_000, 60_000);
    }

    /**
     * @param heartbeatIntervalMillis sweep period, 0 disables the periodic sweep
     * @param pingAfterMillis silence after which a session is pinged
     * @param timeoutMillis silence after which a session is evicted
     */
    public DefaultHub(long heartbeatIntervalMillis, long pingAfterMillis, long timeoutMillis) {
        this(heartbeatIntervalMillis, pingAfterMillis, timeoutMillis, System::currentTimeMillis);
    }

    DefaultHub(long heartbeatIntervalMillis, long pingAfterMillis, long timeoutMillis, LongSupplier clock) {
        checkArgument(heartbeatIntervalMillis >= 0, "heartbeatIntervalMillis");
        checkArgument(timeoutMillis > 0, "timeoutMillis");
        this.pingAfterMillis = pingAfterMillis;
        this.timeoutMillis = timeoutMillis;
        this.clock = clock;
        this.controlLoop = new DefaultEventExecutor(new DefaultThreadFactory("hub-control"));
        this.heartbeatLoop = new DefaultEventExecutor(new DefaultThreadFactory("hub-heartbeat", true));
        if (heartbeatIntervalMillis > 0) {
            this.heartbeatTask = heartbeatLoop.scheduleAtFixedRate(this::doSweep,
                heartbeatIntervalMillis, heartbeatIntervalMillis, TimeUnit.MILLISECONDS);
        }
        else {
            this.heartbeatTask = null;
        }
        log.info("Hub started -> heartbeat: {}ms, ping after: {}ms, timeout: {}ms",
            heartbeatIntervalMillis, pingAfterMillis, timeoutMillis);
    }

    @Override
    public Future<Void> register(ServerSession session) {
        checkNotNull(session, "session");
        return submit(() -> {
            doRegister(session);
            return null;
        });
    }

    private void doRegister(ServerSession session) {
        if (!session.isActive()) {
            log.warn("Client({}) register ignored, session is not active -> {}", session.clientIdentifier(),
                session.id());
            return;
        }
        registry.put(session.id(), session);
        MetricUtil.gauge(METRIC_SESSIONS, registry.size());
        log.info("Client({}) registered -> session: {}, Total clients: {}", session.clientIdentifier(),
            session.id(), registry.size());
    }

    @Override
    public Future<Boolean> unregister(ServerSession session) {
        checkNotNull(session, "session");
        return submit(() -> doUnregister(session));
    }

    private boolean doUnregister(ServerSession session) {
        if (registry.remove(session.id()) == null) {
            log.debug("Client({}) unregister, session not registered -> {}", session.clientIdentifier(),
                session.id());
            return false;
        }
        session.closeOutbound();
        MetricUtil.gauge(METRIC_SESSIONS, registry.size());
        log.info("Client({}) unregistered -> session: {}, Total clients: {}", session.clientIdentifier(),
            session.id(), registry.size());
        return true;
    }

    @Override
    public Future<Integer> broadcast(Message message) {
        checkNotNull(message, "message");
        return submit(() -> doBroadcast(message));
    }

    private int doBroadcast(Message message) {
        String topic = message.topic();
        int accepted = 0;
        for (ServerSession session : registry.values()) {
            if (!interested(session.topics(), topic)) {
                continue;
            }
            if (session.offer(message)) {
                accepted += 1;
            }
        }
        log.debug("broadcast {} -> accepted by {} sessions", message, accepted);
        return accepted;
    }

    static boolean interested(Set<String> topics, String topic) {
        return topic == null || topics.isEmpty() || topics.contains(topic);
    }

    @Override
    public Future<List<ServerSession>> sessions() {
        return submit(() -> new ArrayList<>(registry.values()));
    }

    @Override
    public Future<Integer> publishAgentStatus(String agentId, String status, String details) {
        AgentStatusPayload payload = AgentStatusPayload.builder()
            .agentId(agentId)
            .status(status)
            .lastUpdated(Instant.now())
            .details(details)
            .build();
        return broadcast(Message.agentStatus(payload));
    }

    @Override
    public Future<Integer> publishTransactionUpdate(String txId,
            String status,
            String amount,
            String blockchain,
            String fromAddress,
            String toAddress) {
        TransactionPayload payload = TransactionPayload.builder()
            .txId(txId)
            .status(status)
            .timestamp(Instant.now())
            .amount(amount)
            .blockchain(blockchain)
            .fromAddress(fromAddress)
            .toAddress(toAddress)
            .build();
        return broadcast(Message.transactionUpdate(payload));
    }

    /**
     * run one heartbeat sweep now
     *
     * @return the number of evicted sessions
     */
    public Future<Integer> sweep() {
        try {
            return heartbeatLoop.submit(this::doSweep);
        } catch (RejectedExecutionException e) {
            return ImmediateEventExecutor.INSTANCE.newFailedFuture(e);
        }
    }

    private int doSweep() {
        if (!running.get()) {
            return 0;
        }
        Future<List<ServerSession>> snapshot = sessions().awaitUninterruptibly();
        if (!snapshot.isSuccess()) {
            log.error("heartbeat sweep failed to get the sessions", snapshot.cause());
            return 0;
        }
        long now = clock.getAsLong();
        int evicted = 0;
        for (ServerSession session : snapshot.getNow()) {
            long silence = now - session.lastActive();
            if (silence > timeoutMillis) {
                log.info("Client({}) no activity for {}ms, evict it -> session: {}", session.clientIdentifier(),
                    silence, session.id());
                unregister(session);
                session.close();
                MetricUtil.count(METRIC_EVICTED);
                evicted += 1;
            }
            else if (silence > pingAfterMillis) {
                log.debug("Client({}) no activity for {}ms, ping it", session.clientIdentifier(), silence);
                session.ping();
            }
        }
        return evicted;
    }

    private <T> Future<T> submit(Callable<T> task) {
        if (!running.get()) {
            return ImmediateEventExecutor.INSTANCE.newFailedFuture(new IllegalStateException("Hub is closed"));
        }
        try {
            return controlLoop.submit(task);
        } catch (RejectedExecutionException e) {
            return ImmediateEventExecutor.INSTANCE.newFailedFuture(e);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !controlLoop.isShuttingDown();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Hub is closing...");
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
        }
        heartbeatLoop.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        controlLoop.execute(() -> {
            for (ServerSession session : registry.values()) {
                session.closeOutbound();
            }
            registry.clear();
            MetricUtil.gauge(METRIC_SESSIONS, 0);
        });
        controlLoop.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
        log.info("Hub closed");
    }

}
