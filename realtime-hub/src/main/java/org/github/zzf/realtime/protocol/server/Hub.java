package org.github.zzf.realtime.protocol.server;

import io.netty.util.concurrent.Future;
import java.util.List;
import org.github.zzf.realtime.protocol.model.Message;

/**
 * the single authority over the live sessions.
 * <p>register / unregister / broadcast are requests processed one by one by the Hub's control loop, callers never
 * touch the registry.</p>
 */
public interface Hub {

    Future<Void> register(ServerSession session);

    /**
     * idempotent
     *
     * @return true if the session was registered
     */
    Future<Boolean> unregister(ServerSession session);

    /**
     * fan out to every session subscribed to {@code message.topic()}, or to every session if the message has no topic.
     * Sessions without any subscription receive everything.
     *
     * @return how many sessions accepted the message
     */
    Future<Integer> broadcast(Message message);

    /**
     * a copy of the registry, taken inside the control loop
     */
    Future<List<ServerSession>> sessions();

    Future<Integer> publishAgentStatus(String agentId, String status, String details);

    Future<Integer> publishTransactionUpdate(String txId,
            String status,
            String amount,
            String blockchain,
            String fromAddress,
            String toAddress);

    boolean isRunning();

    void close();

}
