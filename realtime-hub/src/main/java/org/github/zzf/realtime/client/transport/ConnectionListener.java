package org.github.zzf.realtime.client.transport;

/**
 * events of one connect attempt. Every attempt ends with exactly one {@link #onClose(int, String)}, failed attempts
 * included.
 */
public interface ConnectionListener {

    void onOpen(Connection connection);

    void onText(String text);

    void onClose(int code, String reason);

    void onError(Throwable cause);

}
