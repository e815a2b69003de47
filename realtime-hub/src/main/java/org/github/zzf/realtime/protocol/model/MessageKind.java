package org.github.zzf.realtime.protocol.model;

import java.util.HashMap;
import java.util.Map;

/**
 * closed vocabulary of the envelope {@code type} field.
 * <p>{@link #APPLICATION} has no fixed wire name, it carries whatever application type the Hub was configured to
 * accept.</p>
 */
public enum MessageKind {

    AGENT_STATUS("agent_status"),
    TRANSACTION_UPDATE("transaction_update"),
    HEARTBEAT("heartbeat"),
    PING("ping"),
    PONG("pong"),
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    APPLICATION(null),
    ;

    private static final Map<String, MessageKind> BY_TYPE = new HashMap<>();

    static {
        for (MessageKind kind : values()) {
            if (kind.type != null) {
                BY_TYPE.put(kind.type, kind);
            }
        }
    }

    private final String type;

    MessageKind(String type) {
        this.type = type;
    }

    public String type() {
        return type;
    }

    /**
     * @return null if the type is not a reserved one
     */
    public static MessageKind fromType(String type) {
        return type == null ? null : BY_TYPE.get(type);
    }

    /**
     * control messages never reach the application message handler
     */
    public boolean isControl() {
        return this == HEARTBEAT || this == PING || this == PONG || this == SUBSCRIBE || this == UNSUBSCRIBE;
    }

}
