package org.github.zzf.realtime.client;

/**
 * callbacks of a {@link Client}, invoked on the client's event loop.
 */
public interface ClientListener {

    default void onOpen() {
    }

    /**
     * @param message a {@link com.alibaba.fastjson.JSONObject} if the frame is a JSON object, the raw text otherwise
     */
    default void onMessage(Object message) {
    }

    /**
     * the logical connection is gone: closed by the caller, or no more reconnect attempts
     */
    default void onClose(int code, String reason) {
    }

    default void onError(Throwable cause) {
    }

}
