package org.github.zzf.realtime.client.transport;

import java.net.URI;
import java.time.Duration;

public interface Connector {

    /**
     * start a connect attempt, the outcome is reported to the listener
     *
     * @param timeout connect and handshake timeout
     */
    void connect(URI uri, Duration timeout, ConnectionListener listener);

    /**
     * release the resources
     */
    void close();

}
