package com.walkierelay.server.ws;

import com.walkierelay.server.dispatch.EventDispatcher;
import com.walkierelay.server.lifecycle.EventLoop;
import com.walkierelay.server.lifecycle.LifecycleController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Socket callbacks arrive on container threads; each one is handed to the event loop as is.
 * <ul>
 *   <li>connect: refused while draining, otherwise registered with the transport; checked again
 *   on the loop in case draining began in between</li>
 *   <li>text frame: dispatched in arrival order</li>
 *   <li>close: unbound from the transport immediately, then an implicit leave</li>
 * </ul>
 */
@Component
public class SignalingHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(SignalingHandler.class);

    private final WebSocketTransport transport;
    private final EventDispatcher dispatcher;
    private final EventLoop loop;
    private final LifecycleController lifecycle;

    public SignalingHandler(WebSocketTransport transport,
                            EventDispatcher dispatcher,
                            EventLoop loop,
                            LifecycleController lifecycle) {
        this.transport = transport;
        this.dispatcher = dispatcher;
        this.loop = loop;
        this.lifecycle = lifecycle;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        if (!lifecycle.isAcceptingConnections()) {
            log.info("[CONNECT] refused {} while {}", session.getId(), lifecycle.getState());
            try {
                session.close(CloseStatus.SERVICE_RESTARTED);
            } catch (IOException e) {
                log.debug("close of refused session failed: {}", e.getMessage());
            }
            return;
        }
        String connectionId = session.getId();
        transport.register(session);
        loop.execute("connect", () -> {
            if (lifecycle.admit(connectionId)) {
                dispatcher.onConnect(connectionId);
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = session.getId();
        String payload = message.getPayload();
        loop.execute("event", () -> dispatcher.onText(connectionId, payload));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WARN] transport error on {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = session.getId();
        transport.unregister(connectionId);
        loop.execute("disconnect", () -> dispatcher.onDisconnect(connectionId));
        log.debug("[DISCONNECT] {} closed with {}", connectionId, status);
    }
}
