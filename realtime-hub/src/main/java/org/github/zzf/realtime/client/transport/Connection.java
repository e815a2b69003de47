package org.github.zzf.realtime.client.transport;

/**
 * one physical connection
 */
public interface Connection {

    boolean isOpen();

    /**
     * @return false if the text was not accepted (connection not open)
     */
    boolean send(String text);

    void close();

}
