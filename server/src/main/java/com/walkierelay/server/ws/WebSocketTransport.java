package com.walkierelay.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walkierelay.server.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Transport} over Spring WebSocket sessions. Frames are JSON envelopes
 * {@code {"event": ..., "data": ...}}.
 */
@Component
public class WebSocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final RoomRegistry rooms;
    private final int bufferSizeLimit;

    public WebSocketTransport(RoomRegistry rooms,
                              @Value("${walkie.ws.max-message-bytes:10485760}") int bufferSizeLimit) {
        this.rooms = rooms;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, bufferSizeLimit));
    }

    public void unregister(String connectionId) {
        sessions.remove(connectionId);
        rooms.removeEverywhere(connectionId);
    }

    @Override
    public void send(String connectionId, String event, Object data) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null) {
            log.debug("[WARN] drop {} for closed connection {}", event, connectionId);
            return;
        }
        String json;
        try {
            json = mapper.writeValueAsString(new OutboundMessage(event, data));
        } catch (JsonProcessingException e) {
            log.error("[ERROR] cannot serialize {}", event, e);
            return;
        }
        deliver(session, event, json);
    }

    @Override
    public void broadcast(String room, String event, Object data, String exceptConnectionId) {
        String json;
        try {
            json = mapper.writeValueAsString(new OutboundMessage(event, data));
        } catch (JsonProcessingException e) {
            log.error("[ERROR] cannot serialize {}", event, e);
            return;
        }
        for (String connectionId : rooms.get(room)) {
            if (connectionId.equals(exceptConnectionId)) continue;
            WebSocketSession session = sessions.get(connectionId);
            if (session != null) deliver(session, event, json);
        }
    }

    @Override
    public void join(String connectionId, String room) {
        rooms.add(room, connectionId);
    }

    @Override
    public void leave(String connectionId, String room) {
        rooms.remove(room, connectionId);
    }

    @Override
    public void close(String connectionId) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null) return;
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.warn("[WARN] close failed for {}: {}", connectionId, e.getMessage());
        }
    }

    private void deliver(WebSocketSession session, String event, String json) {
        if (!session.isOpen()) return;
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | IllegalStateException e) {
            log.warn("[WARN] send {} failed to {}: {}", event, session.getId(), e.getMessage());
        }
    }
}
