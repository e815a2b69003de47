package org.github.zzf.realtime.client;

import java.util.Set;
import org.github.zzf.realtime.protocol.model.Message;

/**
 * a single logical connection to the hub that survives the loss of the physical one.
 * <pre>
 *     create -> connect -> (open / reconnecting)* -> close -> shutdown
 * </pre>
 * <p>Every call is safe from any thread and in any state, none of them throws because of connectivity.</p>
 */
public interface Client extends AutoCloseable {

    /**
     * no-op if the connection is open or a connect attempt is in progress
     *
     * @return the state after the call
     */
    ConnectionState connect(ClientListener listener);

    /**
     * @return true if written to the connection now, false if queued or dropped
     */
    boolean send(Message message, boolean priority);

    default boolean send(Message message) {
        return send(message, false);
    }

    /**
     * send raw text, it is not validated
     */
    boolean send(String text, boolean priority);

    void subscribe(String topic);

    void unsubscribe(String topic);

    Set<String> subscriptions();

    ConnectionState state();

    boolean isConnected();

    int pendingMessages();

    /**
     * close the logical connection, cancel the timers and discard the queue. The client can connect again.
     */
    @Override
    void close();

    /**
     * close and release the event loop and the connector
     */
    void shutdown();

}
