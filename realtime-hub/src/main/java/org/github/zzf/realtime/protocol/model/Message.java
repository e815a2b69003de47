package org.github.zzf.realtime.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.alibaba.fastjson.JSONObject;
import java.time.Instant;
import java.util.Objects;

/**
 * the envelope carried by every frame.
 * <p>Immutable. The {@link MessageKind} decides the payload shape:</p>
 * <pre>
 *     AGENT_STATUS         -> {@link AgentStatusPayload}, topic = agentId
 *     TRANSACTION_UPDATE   -> {@link TransactionPayload}, topic = txId
 *     SUBSCRIBE/UNSUBSCRIBE -> no payload, topic required
 *     HEARTBEAT/PING/PONG  -> no payload
 *     APPLICATION          -> opaque JSONObject (may be null)
 * </pre>
 */
public final class Message {

    private final MessageKind kind;
    private final String type;
    private final String topic;
    private final Object payload;
    private final Instant timestamp;

    private Message(MessageKind kind, String type, String topic, Object payload, Instant timestamp) {
        this.kind = checkNotNull(kind, "kind");
        this.type = checkNotNull(type, "type");
        this.topic = topic;
        this.payload = payload;
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
        checkPayloadShape();
    }

    public static Message agentStatus(AgentStatusPayload payload) {
        return agentStatus(payload, null);
    }

    public static Message agentStatus(AgentStatusPayload payload, Instant timestamp) {
        checkNotNull(payload, "payload");
        return new Message(MessageKind.AGENT_STATUS, MessageKind.AGENT_STATUS.type(), payload.getAgentId(), payload,
            timestamp);
    }

    public static Message transactionUpdate(TransactionPayload payload) {
        return transactionUpdate(payload, null);
    }

    public static Message transactionUpdate(TransactionPayload payload, Instant timestamp) {
        checkNotNull(payload, "payload");
        return new Message(MessageKind.TRANSACTION_UPDATE, MessageKind.TRANSACTION_UPDATE.type(), payload.getTxId(),
            payload, timestamp);
    }

    public static Message subscribe(String topic) {
        return control(MessageKind.SUBSCRIBE, topic, null);
    }

    public static Message unsubscribe(String topic) {
        return control(MessageKind.UNSUBSCRIBE, topic, null);
    }

    public static Message heartbeat() {
        return control(MessageKind.HEARTBEAT, null, null);
    }

    public static Message ping() {
        return control(MessageKind.PING, null, null);
    }

    public static Message pong() {
        return control(MessageKind.PONG, null, null);
    }

    public static Message control(MessageKind kind, String topic, Instant timestamp) {
        checkArgument(kind.isControl(), "not a control kind: %s", kind);
        return new Message(kind, kind.type(), topic, null, timestamp);
    }

    /**
     * application defined message, the topic is optional (null means every session)
     */
    public static Message application(String type, String topic, JSONObject payload) {
        return application(type, topic, payload, null);
    }

    public static Message application(String type, String topic, JSONObject payload, Instant timestamp) {
        checkArgument(type != null && !type.isEmpty(), "type is required");
        checkArgument(MessageKind.fromType(type) == null, "reserved type: %s", type);
        return new Message(MessageKind.APPLICATION, type, topic, payload, timestamp);
    }

    private void checkPayloadShape() {
        switch (kind) {
            case AGENT_STATUS -> checkArgument(payload instanceof AgentStatusPayload, "AgentStatusPayload required");
            case TRANSACTION_UPDATE -> checkArgument(payload instanceof TransactionPayload,
                "TransactionPayload required");
            case SUBSCRIBE, UNSUBSCRIBE -> checkArgument(topic != null && !topic.isEmpty(), "topic is required");
            case APPLICATION -> checkArgument(payload == null || payload instanceof JSONObject,
                "JSONObject payload required");
            default -> checkArgument(payload == null, "%s carries no payload", kind);
        }
    }

    public MessageKind kind() {
        return kind;
    }

    /**
     * the wire type, equals {@code kind().type()} except for {@link MessageKind#APPLICATION}
     */
    public String type() {
        return type;
    }

    /**
     * @return null for untargeted messages
     */
    public String topic() {
        return topic;
    }

    public Object payload() {
        return payload;
    }

    public <T> T payload(Class<T> clazz) {
        return clazz.cast(payload);
    }

    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message)) {
            return false;
        }
        Message that = (Message) o;
        return kind == that.kind
            && type.equals(that.type)
            && Objects.equals(topic, that.topic)
            && Objects.equals(payload, that.payload)
            && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, type, topic, payload, timestamp);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"type\":\"").append(type).append('\"').append(',');
        if (topic != null) {
            sb.append("\"topic\":\"").append(topic).append('\"').append(',');
        }
        if (payload != null) {
            sb.append("\"payload\":\"").append(payload).append('\"').append(',');
        }
        sb.append("\"timestamp\":\"").append(timestamp).append('\"').append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
