package com.walkierelay.server.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walkierelay.server.exception.ErrorCode;
import com.walkierelay.server.exception.SignalingException;
import com.walkierelay.server.model.AudioChunkMessage;
import com.walkierelay.server.model.AudioDataMessage;
import com.walkierelay.server.model.AudioUrlMessage;
import com.walkierelay.server.model.ChannelRequest;
import com.walkierelay.server.model.ConnectionRequest;
import com.walkierelay.server.model.InboundEvent;
import com.walkierelay.server.model.InboundMessage;
import com.walkierelay.server.model.JoinChannelRequest;
import com.walkierelay.server.model.OutboundEvent;
import com.walkierelay.server.model.Payloads;
import com.walkierelay.server.model.SignalMessage;
import com.walkierelay.server.model.TransmissionMessage;
import com.walkierelay.server.presence.PresenceBroadcaster;
import com.walkierelay.server.registry.ConnectionRegistry;
import com.walkierelay.server.relay.MediaRelay;
import com.walkierelay.server.signaling.SignalKind;
import com.walkierelay.server.signaling.SignalingRouter;
import com.walkierelay.server.ws.Transport;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for everything a connection does, always called on the event loop:
 * <ul>
 *   <li>connect: register the connection and greet it with {@code connected}</li>
 *   <li>text frame: parse the envelope, validate the payload, route by event name</li>
 *   <li>disconnect: implicit leave and removal</li>
 * </ul>
 * A rejected event produces one {@code error} reply to its sender and nothing else.
 */
@Component
public class EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final ConnectionRegistry connections;
    private final PresenceBroadcaster presence;
    private final SignalingRouter router;
    private final MediaRelay relay;
    private final Transport transport;
    private final Clock clock;

    public EventDispatcher(ConnectionRegistry connections,
                           PresenceBroadcaster presence,
                           SignalingRouter router,
                           MediaRelay relay,
                           Transport transport,
                           Clock clock) {
        this.connections = connections;
        this.presence = presence;
        this.router = router;
        this.relay = relay;
        this.transport = transport;
        this.clock = clock;
    }

    public void onConnect(String connectionId) {
        connections.register(connectionId);
        transport.send(connectionId, OutboundEvent.CONNECTED.wireName(),
                Payloads.of("socketId", connectionId, "timestamp", clock.millis()));
        log.info("[CONNECT] {} connections={}", connectionId, connections.size());
    }

    public void onDisconnect(String connectionId) {
        presence.disconnect(connectionId);
    }

    public void onText(String connectionId, String text) {
        InboundMessage message;
        try {
            message = mapper.readValue(text, InboundMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("[WARN] invalid json from {}: {}", connectionId, e.getOriginalMessage());
            reject(connectionId, null, new SignalingException(ErrorCode.MALFORMED_MESSAGE, "frame is not a JSON event envelope"));
            return;
        }
        if (message == null || message.event == null || message.event.isBlank()) {
            reject(connectionId, null, new SignalingException(ErrorCode.MALFORMED_MESSAGE, "event is required"));
            return;
        }
        dispatch(connectionId, message.event, message.data);
    }

    public void dispatch(String connectionId, String event, JsonNode data) {
        if (connections.lookup(connectionId).isEmpty()) {
            log.warn("[WARN] {} from unregistered connection {}", event, connectionId);
            return;
        }
        Optional<InboundEvent> type = InboundEvent.fromWire(event);
        if (type.isEmpty()) {
            reject(connectionId, event, new SignalingException(ErrorCode.UNKNOWN_EVENT, "unknown event " + event));
            return;
        }
        try {
            route(connectionId, type.get(), data);
        } catch (SignalingException e) {
            reject(connectionId, event, e);
        }
    }

    private void route(String connectionId, InboundEvent type, JsonNode data) {
        String event = type.wireName();
        switch (type) {
            case JOIN_CHANNEL -> {
                JoinChannelRequest join = read(data, JoinChannelRequest.class);
                presence.join(connectionId, join.channelId, join.userId);
            }
            case LEAVE_CHANNEL -> presence.leave(connectionId, read(data, ChannelRequest.class).channelId);
            case GET_CHANNEL_USERS -> presence.channelUsers(connectionId, read(data, ChannelRequest.class).channelId);
            case AUDIO_DATA -> relay.audioData(connectionId, read(data, AudioDataMessage.class));
            case AUDIO_URL -> relay.audioUrl(connectionId, read(data, AudioUrlMessage.class));
            case AUDIO_CHUNK -> relay.audioChunk(connectionId, read(data, AudioChunkMessage.class));
            case TRANSMISSION_START -> relay.transmissionStart(connectionId, read(data, TransmissionMessage.class));
            case TRANSMISSION_END -> relay.transmissionEnd(connectionId, read(data, TransmissionMessage.class));
            case WEBRTC_OFFER -> router.relay(connectionId, event, SignalKind.OFFER, read(data, SignalMessage.class));
            case WEBRTC_ANSWER -> router.relay(connectionId, event, SignalKind.ANSWER, read(data, SignalMessage.class));
            case WEBRTC_ICE_CANDIDATE, ICE_CANDIDATE ->
                    router.relay(connectionId, event, SignalKind.ICE_CANDIDATE, read(data, SignalMessage.class));
            case REQUEST_WEBRTC_CONNECTION -> router.requestConnection(connectionId, read(data, ConnectionRequest.class));
            case PING -> transport.send(connectionId, OutboundEvent.PONG.wireName(), Payloads.of("timestamp", clock.millis()));
        }
    }

    private <T> T read(JsonNode data, Class<T> type) {
        T value;
        try {
            value = mapper.treeToValue(data == null || data.isNull() ? mapper.createObjectNode() : data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SignalingException(ErrorCode.INVALID_PAYLOAD, "payload does not match " + type.getSimpleName());
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new SignalingException(ErrorCode.INVALID_PAYLOAD, detail);
        }
        return value;
    }

    private void reject(String connectionId, String event, SignalingException e) {
        log.warn("[WARN] {} from {} rejected: {} {}", event, connectionId, e.getCode().wireCode(), e.getMessage());
        transport.send(connectionId, OutboundEvent.ERROR.wireName(),
                Payloads.error(e.getCode().wireCode(), e.getMessage(), event));
    }
}
