package com.walkierelay.server.signaling;

import com.fasterxml.jackson.databind.JsonNode;
import com.walkierelay.server.exception.ErrorCode;
import com.walkierelay.server.exception.SignalingException;
import com.walkierelay.server.model.ConnectionRequest;
import com.walkierelay.server.model.OutboundEvent;
import com.walkierelay.server.model.Payloads;
import com.walkierelay.server.model.SignalMessage;
import com.walkierelay.server.registry.ChannelDirectory;
import com.walkierelay.server.registry.Connection;
import com.walkierelay.server.registry.ConnectionRegistry;
import com.walkierelay.server.registry.Member;
import com.walkierelay.server.ws.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Relays offers, answers and ICE candidates without looking inside them.
 * <p>
 * Both addressing forms resolve to a {@link Destination}. A {@code to} identity is resolved
 * across all channels only when {@code walkie.signaling.allow-global-addressing} is on;
 * otherwise it is looked up inside the sender's own channel. An unreachable destination drops
 * the signal silently.
 */
@Component
public class SignalingRouter {
    private static final Logger log = LoggerFactory.getLogger(SignalingRouter.class);

    private final ConnectionRegistry connections;
    private final ChannelDirectory channels;
    private final Transport transport;
    private final boolean allowGlobalAddressing;

    public SignalingRouter(ConnectionRegistry connections,
                           ChannelDirectory channels,
                           Transport transport,
                           @Value("${walkie.signaling.allow-global-addressing:false}") boolean allowGlobalAddressing) {
        this.connections = connections;
        this.channels = channels;
        this.transport = transport;
        this.allowGlobalAddressing = allowGlobalAddressing;
    }

    public void relay(String connectionId, String event, SignalKind kind, SignalMessage message) {
        JsonNode payload = kind.payloadOf(message);
        if (payload == null || payload.isNull()) {
            throw new SignalingException(ErrorCode.INVALID_PAYLOAD, kind.field() + " is required");
        }
        if (kind == SignalKind.ANSWER && !message.isGloballyAddressed() && !message.isTargeted()) {
            throw new SignalingException(ErrorCode.INVALID_PAYLOAD, "targetUserId is required");
        }

        Connection sender = connections.requireIdentified(connectionId);
        Destination destination = resolveAddress(sender, message);

        Map<String, Object> out = Payloads.of("userId", sender.getUserId(), kind.field(), payload);
        if (message.isGloballyAddressed()) {
            out.put("from", sender.getUserId());
        }
        log.info("[SIGNAL] {} from {} to {}", event, sender.getUserId(), destination);
        deliver(sender, destination, event, out);
    }

    public void requestConnection(String connectionId, ConnectionRequest request) {
        Connection sender = connections.requireMember(connectionId, request.channelId);
        log.info("[SIGNAL] {} requests connection with {}", sender.getUserId(), request.targetUserId);
        deliver(sender,
                Destination.direct(request.targetUserId, request.channelId),
                OutboundEvent.WEBRTC_CONNECTION_REQUEST.wireName(),
                Payloads.of("userId", sender.getUserId()));
    }

    Destination resolveAddress(Connection sender, SignalMessage message) {
        if (message.isGloballyAddressed()) {
            if (allowGlobalAddressing) {
                return Destination.direct(message.to, null);
            }
            String scope = sender.getCurrentChannel();
            if (scope == null) {
                throw new SignalingException(ErrorCode.NOT_IN_CHANNEL,
                        "global addressing is disabled, join a channel first");
            }
            return Destination.direct(message.to, scope);
        }
        connections.requireMember(sender.getConnectionId(), message.channelId);
        if (message.isTargeted()) {
            return Destination.direct(message.targetUserId, message.channelId);
        }
        return Destination.broadcast(message.channelId);
    }

    /** The connection a direct destination resolves to, if it is reachable. */
    Optional<Connection> resolveTarget(Destination destination) {
        if (destination.isGlobal()) {
            return connections.lookupByUserId(destination.getUserId());
        }
        return channels.find(destination.getChannelId())
                .flatMap(c -> c.findMemberByUserId(destination.getUserId()))
                .map(Member::getConnectionId)
                .flatMap(connections::lookup);
    }

    private void deliver(Connection sender, Destination destination, String event, Object payload) {
        if (destination.getKind() == Destination.Kind.BROADCAST) {
            transport.broadcast(destination.getChannelId(), event, payload, sender.getConnectionId());
            return;
        }
        Optional<Connection> target = resolveTarget(destination);
        if (target.isEmpty()) {
            log.info("[SIGNAL] {} from {} dropped: {} is not reachable", event, sender.getUserId(), destination.getUserId());
            return;
        }
        if (destination.isGlobal()
                && !Objects.equals(target.get().getCurrentChannel(), sender.getCurrentChannel())) {
            log.warn("[SIGNAL] {} from {} crosses channels ({} -> {})", event, sender.getUserId(),
                    sender.getCurrentChannel(), target.get().getCurrentChannel());
        }
        transport.send(target.get().getConnectionId(), event, payload);
    }
}
