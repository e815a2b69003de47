package org.github.zzf.realtime.protocol.server;

import org.github.zzf.realtime.protocol.model.Message;

/**
 * receives the non-control messages a client sends.
 * <p>Invoked on the connection's event loop, implementations must not block.</p>
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(String clientIdentifier, Message message);

}
