package org.github.zzf.realtime.protocol.codec;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.AgentStatusPayload;
import org.github.zzf.realtime.protocol.model.Message;
import org.github.zzf.realtime.protocol.model.MessageKind;
import org.github.zzf.realtime.protocol.model.TransactionPayload;

/**
 * JSON text &lt;-&gt; {@link Message}.
 * <pre>
 *     {"type":"agent_status","topic":"agent-123","payload":{...},"timestamp":"2024-11-05T10:00:00Z"}
 * </pre>
 * <p>Fields are looked up by name, unknown fields are ignored.</p>
 */
@Slf4j
public class MessageCodec {

    public static final String F_TYPE = "type";
    public static final String F_TOPIC = "topic";
    public static final String F_PAYLOAD = "payload";
    public static final String F_TIMESTAMP = "timestamp";

    private final Set<String> applicationTypes;

    public MessageCodec() {
        this(Collections.emptySet());
    }

    /**
     * @param applicationTypes types decoded as {@link MessageKind#APPLICATION}, anything else not reserved is dropped
     */
    public MessageCodec(Collection<String> applicationTypes) {
        this.applicationTypes = Set.copyOf(applicationTypes);
    }

    public String encode(Message message) {
        return JSON.toJSONString(toJson(message));
    }

    public JSONObject toJson(Message message) {
        JSONObject json = new JSONObject(true);
        json.put(F_TYPE, message.type());
        if (message.topic() != null) {
            json.put(F_TOPIC, message.topic());
        }
        Object payload = message.payload();
        if (payload instanceof AgentStatusPayload asp) {
            json.put(F_PAYLOAD, asp.toJson());
        }
        else if (payload instanceof TransactionPayload tp) {
            json.put(F_PAYLOAD, tp.toJson());
        }
        else if (payload != null) {
            json.put(F_PAYLOAD, payload);
        }
        json.put(F_TIMESTAMP, message.timestamp().toString());
        return json;
    }

    /**
     * @return empty if the type is neither reserved nor a configured application type
     * @throws DecodeException the text is not a JSON object or does not fit the shape of its type
     */
    public Optional<Message> decode(String text) {
        JSONObject json;
        try {
            json = JSON.parseObject(text);
        } catch (RuntimeException e) {
            throw new DecodeException("not a JSON object", e);
        }
        if (json == null) {
            throw new DecodeException("empty frame");
        }
        String type = json.getString(F_TYPE);
        if (type == null || type.isEmpty()) {
            throw new DecodeException("type is required");
        }
        MessageKind kind = MessageKind.fromType(type);
        if (kind == null && !applicationTypes.contains(type)) {
            log.warn("decode unknown message type, drop it -> type: {}", type);
            return Optional.empty();
        }
        try {
            return Optional.of(decode(kind, type, json));
        } catch (DecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodeException("malformed " + type + " message", e);
        }
    }

    private Message decode(MessageKind kind, String type, JSONObject json) {
        Instant timestamp = Optional.ofNullable(json.getString(F_TIMESTAMP)).map(Instant::parse).orElse(null);
        if (kind == null) {
            return Message.application(type, json.getString(F_TOPIC), json.getJSONObject(F_PAYLOAD), timestamp);
        }
        return switch (kind) {
            case AGENT_STATUS -> Message.agentStatus(AgentStatusPayload.fromJson(payloadObject(json)), timestamp);
            case TRANSACTION_UPDATE ->
                Message.transactionUpdate(TransactionPayload.fromJson(payloadObject(json)), timestamp);
            case SUBSCRIBE, UNSUBSCRIBE -> Message.control(kind, controlTopic(json), timestamp);
            case HEARTBEAT, PING, PONG -> Message.control(kind, json.getString(F_TOPIC), timestamp);
            default -> throw new DecodeException("unexpected kind: " + kind);
        };
    }

    private static JSONObject payloadObject(JSONObject json) {
        JSONObject payload = json.getJSONObject(F_PAYLOAD);
        if (payload == null) {
            throw new DecodeException("payload is required");
        }
        return payload;
    }

    /**
     * {"type":"subscribe","topic":"t"} / {"type":"subscribe","payload":"t"} / {"type":"subscribe","payload":{"topic":"t"}}
     */
    private static String controlTopic(JSONObject json) {
        String topic = json.getString(F_TOPIC);
        if (topic == null) {
            Object payload = json.get(F_PAYLOAD);
            if (payload instanceof String str) {
                topic = str;
            }
            else if (payload instanceof JSONObject po) {
                topic = po.getString(F_TOPIC);
            }
        }
        if (topic == null || topic.isEmpty()) {
            throw new DecodeException("topic is required");
        }
        return topic;
    }

    public static class DecodeException extends RuntimeException {

        public DecodeException(String message) {
            super(message);
        }

        public DecodeException(String message, Throwable cause) {
            super(message, cause);
        }

    }

}
