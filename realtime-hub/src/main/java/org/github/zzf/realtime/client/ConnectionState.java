package org.github.zzf.realtime.client;

public enum ConnectionState {
    /* never connected */
    IDLE,
    CONNECTING,
    OPEN,
    /* waiting for the reconnect timer */
    RECONNECTING,
    /* closed by the caller, or reconnect attempts exhausted */
    CLOSED,
    ;

    public boolean isConnecting() {
        return this == CONNECTING || this == RECONNECTING;
    }
}
