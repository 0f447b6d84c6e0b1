package com.walkierelay.server.ws;

/**
 * What the relay core needs from the socket layer. Delivery is best-effort: a failed send is
 * logged by the implementation and never reported back.
 */
public interface Transport {

    void send(String connectionId, String event, Object data);

    /**
     * Delivers to every connection bound to {@code room} except {@code exceptConnectionId}
     * (null excludes nobody).
     */
    void broadcast(String room, String event, Object data, String exceptConnectionId);

    void join(String connectionId, String room);

    void leave(String connectionId, String room);

    /** Server-initiated close. */
    void close(String connectionId);
}
