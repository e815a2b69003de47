package org.github.zzf.realtime.client;

import static org.assertj.core.api.BDDAssertions.then;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import org.github.zzf.realtime.client.FakeConnector.FakeConnection;
import org.github.zzf.realtime.protocol.model.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReconnectClientTest {

    FakeConnector connector;
    ReconnectClient client;
    RecordingListener listener;

    @BeforeEach
    void beforeEach() {
        connector = new FakeConnector();
        listener = new RecordingListener();
    }

    @AfterEach
    void afterEach() {
        if (client != null) {
            client.shutdown();
        }
    }

    private ReconnectClient client(ClientConfig.ClientConfigBuilder builder) {
        client = new ReconnectClient(builder.clientId("c1").token("valid-token").build(), connector);
        return client;
    }

    private static ClientConfig.ClientConfigBuilder fast() {
        return ClientConfig.builder()
            .reconnectInterval(10)
            .heartbeatInterval(0);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        then(condition.getAsBoolean()).isTrue();
    }

    private static List<String> types(List<String> sent) {
        return sent.stream().map(t -> JSON.parseObject(t).getString("type")).collect(Collectors.toList());
    }

    @Test
    void givenOfflineSends_whenConnectionOpens_thenPriorityFlushedFirst() throws InterruptedException {
        client(fast());
        client.send("{\"type\":\"x1\"}", false);
        client.send("{\"type\":\"x2\"}", false);
        client.send("{\"type\":\"y\"}", true);
        then(client.pendingMessages()).isEqualTo(3);

        client.connect(listener);
        FakeConnection conn = connector.open(0);

        await(() -> conn.sent.size() == 3);
        then(types(conn.sent)).containsExactly("y", "x1", "x2");
        then(client.pendingMessages()).isZero();
        then(listener.opened.get()).isEqualTo(1);
    }

    @Test
    void givenOpenConnection_whenSend_thenWrittenImmediately() throws InterruptedException {
        client(fast());
        client.connect(listener);
        FakeConnection conn = connector.open(0);
        await(client::isConnected);

        boolean written = client.send(Message.heartbeat());

        then(written).isTrue();
        then(types(conn.sent)).containsExactly("heartbeat");
    }

    @Test
    void givenConnecting_whenConnectAgain_thenNoSecondAttempt() {
        client(fast());

        ConnectionState first = client.connect(listener);
        ConnectionState second = client.connect(listener);

        then(first).isEqualTo(ConnectionState.CONNECTING);
        then(second).isEqualTo(ConnectionState.CONNECTING);
        then(connector.attempts).hasSize(1);
        then(connector.uris.get(0).getQuery()).isEqualTo("client_id=c1&token=valid-token");
    }

    @Test
    void givenServerAlwaysDown_whenConnect_thenGiveUpAfterMaxAttempts() throws InterruptedException {
        connector.refuse = true;
        client(fast().maxReconnectAttempts(5));

        client.connect(listener);

        then(listener.closed.await(5, TimeUnit.SECONDS)).isTrue();
        // the first attempt plus 5 reconnects
        then(connector.attempts).hasSize(6);
        then(listener.closeCode.get()).isEqualTo(1006);
        then(listener.errors.get()).isEqualTo(6);
        then(client.state()).isEqualTo(ConnectionState.CLOSED);
    }

    @Test
    void givenAutoReconnectOff_whenConnectionLost_thenClosed() throws InterruptedException {
        client(fast().autoReconnect(false));
        client.connect(listener);
        FakeConnection conn = connector.open(0);
        await(client::isConnected);

        conn.drop();

        then(listener.closed.await(5, TimeUnit.SECONDS)).isTrue();
        then(connector.attempts).hasSize(1);
    }

    @Test
    void givenReconnectScheduled_whenClose_thenNoMoreAttempts() throws InterruptedException {
        connector.refuse = true;
        client(fast().reconnectInterval(200));
        client.connect(listener);
        await(() -> client.state() == ConnectionState.RECONNECTING);

        client.close();
        Thread.sleep(500);

        then(connector.attempts).hasSize(1);
        then(client.state()).isEqualTo(ConnectionState.CLOSED);
    }

    @Test
    void givenLostConnection_whenReconnected_thenSubscriptionsReasserted() throws InterruptedException {
        client(fast());
        client.connect(listener);
        FakeConnection first = connector.open(0);
        await(client::isConnected);
        client.subscribe("agent-42");
        then(types(first.sent)).containsExactly("subscribe");

        first.drop();
        await(() -> connector.attempts.size() == 2);
        FakeConnection second = connector.open(1);

        await(() -> second.sent.size() == 1);
        JSONObject resubscribe = JSON.parseObject(second.sent.get(0));
        then(resubscribe.getString("type")).isEqualTo("subscribe");
        then(resubscribe.getString("topic")).isEqualTo("agent-42");
        then(listener.opened.get()).isEqualTo(2);
    }

    @Test
    void givenOfflineSubscribe_whenOpen_thenSentOnce() throws InterruptedException {
        client(fast());
        client.subscribe("agent-42");
        client.subscribe("agent-42");
        client.send("{\"type\":\"x1\"}", false);

        client.connect(listener);
        FakeConnection conn = connector.open(0);

        await(() -> conn.sent.size() == 2);
        Thread.sleep(50);
        then(types(conn.sent)).containsExactly("subscribe", "x1");
        then(client.subscriptions()).containsExactly("agent-42");
    }

    @Test
    void givenOfflineSubscribeThenUnsubscribe_whenOpen_thenOnlyLastIntentSent() throws InterruptedException {
        client(fast());
        client.subscribe("agent-42");
        client.unsubscribe("agent-42");
        client.unsubscribe("tx-7");
        client.subscribe("tx-7");

        client.connect(listener);
        FakeConnection conn = connector.open(0);

        await(() -> conn.sent.size() == 2);
        Thread.sleep(50);
        List<JSONObject> sent = conn.sent.stream().map(JSON::parseObject).collect(Collectors.toList());
        then(sent).extracting(m -> m.getString("type") + ":" + m.getString("topic"))
            .containsExactly("subscribe:tx-7", "unsubscribe:agent-42");
        then(client.subscriptions()).containsExactly("tx-7");
    }

    @Test
    void givenSeveralSubscriptions_whenReconnected_thenReassertedInSubscriptionOrder() throws InterruptedException {
        client(fast());
        client.connect(listener);
        FakeConnection first = connector.open(0);
        await(client::isConnected);
        client.subscribe("agent-1");
        client.subscribe("agent-2");
        client.subscribe("agent-3");

        first.drop();
        await(() -> connector.attempts.size() == 2);
        FakeConnection second = connector.open(1);

        await(() -> second.sent.size() == 3);
        then(second.sent).extracting(t -> JSON.parseObject(t).getString("topic"))
            .containsExactly("agent-1", "agent-2", "agent-3");
    }

    @Test
    void givenHeartbeatInterval_whenOpen_thenHeartbeatsSent() throws InterruptedException {
        client(fast().heartbeatInterval(20));
        client.connect(listener);
        FakeConnection conn = connector.open(0);

        await(() -> conn.sent.size() >= 2);
        then(types(conn.sent)).containsOnly("heartbeat");
    }

    @Test
    void givenInboundText_whenReceived_thenJsonObjectOrRawString() throws InterruptedException {
        client(fast());
        client.connect(listener);
        FakeConnection conn = connector.open(0);

        conn.receive("{\"type\":\"agent_status\",\"topic\":\"42\"}");
        conn.receive("plain text");

        Object first = listener.messages.poll(5, TimeUnit.SECONDS);
        Object second = listener.messages.poll(5, TimeUnit.SECONDS);
        then(first).isInstanceOf(JSONObject.class);
        then(((JSONObject) first).getString("topic")).isEqualTo("42");
        then(second).isEqualTo("plain text");
    }

    @Test
    void givenFailingListener_whenMessage_thenClientKeepsRunning() throws InterruptedException {
        client(fast());
        client.connect(new ClientListener() {
            @Override
            public void onMessage(Object message) {
                throw new IllegalStateException("boom");
            }
        });
        FakeConnection conn = connector.open(0);
        await(client::isConnected);

        conn.receive("{\"type\":\"pong\"}");

        then(client.send("{\"type\":\"x\"}", false)).isTrue();
        then(client.isConnected()).isTrue();
    }

    @Test
    void givenBoundedQueue_whenOverflow_thenOldestDropped() {
        client(fast().maxPendingMessages(2));

        client.send("{\"type\":\"x1\"}", false);
        client.send("{\"type\":\"x2\"}", false);
        client.send("{\"type\":\"x3\"}", false);

        then(client.pendingMessages()).isEqualTo(2);
    }

    @Test
    void givenAnyState_whenClose_thenSafe() throws InterruptedException {
        client(fast());
        client.close();
        client.close();
        then(client.state()).isEqualTo(ConnectionState.CLOSED);

        client.connect(listener);
        FakeConnection conn = connector.open(0);
        await(client::isConnected);
        client.send("{\"type\":\"x\"}", false);

        client.close();

        then(conn.isOpen()).isFalse();
        then(client.pendingMessages()).isZero();
        then(client.subscriptions()).isEmpty();
        then(listener.closed.await(1, TimeUnit.SECONDS)).isTrue();
        then(listener.closeCode.get()).isEqualTo(ReconnectClient.CLOSE_NORMAL);
    }

    @Test
    void givenShutdown_whenCalled_thenConnectorReleased() {
        client(fast());

        client.shutdown();
        client.close();

        then(connector.closed).isTrue();
    }

    static class RecordingListener implements ClientListener {

        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();
        final AtomicInteger closeCode = new AtomicInteger();
        final CountDownLatch closed = new CountDownLatch(1);
        final BlockingQueue<Object> messages = new LinkedBlockingQueue<>();

        @Override
        public void onOpen() {
            opened.incrementAndGet();
        }

        @Override
        public void onMessage(Object message) {
            messages.add(message);
        }

        @Override
        public void onClose(int code, String reason) {
            closeCode.set(code);
            closed.countDown();
        }

        @Override
        public void onError(Throwable cause) {
            errors.incrementAndGet();
        }

    }

}
