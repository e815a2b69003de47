package org.github.zzf.realtime.protocol.server;

import java.util.Set;
import org.github.zzf.realtime.protocol.model.Message;

/**
 * server side state of one physical connection
 */
public interface ServerSession {

    /**
     * unique per connection. A reconnecting client always gets a new id.
     */
    String id();

    /**
     * caller supplied, for logging and metrics only
     */
    String clientIdentifier();

    SessionState state();

    /**
     * @return an immutable snapshot
     */
    Set<String> topics();

    /**
     * epoch millis of the last received frame
     */
    long lastActive();

    /**
     * non-blocking enqueue onto the outbound queue.
     *
     * @return false if the message was dropped (queue full or outbound closed)
     */
    boolean offer(Message message);

    /**
     * called by the Hub after the session left the registry, the writer stops and the connection is closed.
     */
    void closeOutbound();

    /**
     * protocol level ping
     */
    void ping();

    /**
     * idempotent teardown
     */
    void close();

    boolean isActive();

    enum SessionState {
        CONNECTING,
        OPEN,
        CLOSING,
        CLOSED,
    }

}
