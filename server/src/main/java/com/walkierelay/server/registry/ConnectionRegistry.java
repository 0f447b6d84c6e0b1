package com.walkierelay.server.registry;

import com.walkierelay.server.exception.ErrorCode;
import com.walkierelay.server.exception.SignalingException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps connection ids to session records, with a secondary identity index kept in
 * lock-step with the primary map.
 * <p>
 * Not thread-safe: only the event loop touches it.
 */
@Component
public class ConnectionRegistry {

    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<String, Set<String>> byUserId = new HashMap<>();
    private final Clock clock;

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    public Connection register(String connectionId) {
        if (connections.containsKey(connectionId)) {
            throw new IllegalStateException("connection already registered: " + connectionId);
        }
        Connection connection = new Connection(connectionId, clock.instant());
        connections.put(connectionId, connection);
        return connection;
    }

    public Optional<Connection> lookup(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    /**
     * Resolves an identity to a connection. When several connections share the identity the
     * earliest one to claim it wins.
     */
    public Optional<Connection> lookupByUserId(String userId) {
        Set<String> ids = byUserId.get(userId);
        if (ids == null || ids.isEmpty()) return Optional.empty();
        return lookup(ids.iterator().next());
    }

    /**
     * Sets the identity once. Repeating the same identity is a no-op; a different one is rejected.
     */
    public void setIdentity(String connectionId, String userId) {
        Connection connection = require(connectionId);
        if (userId.equals(connection.getUserId())) return;
        if (connection.hasIdentity()) {
            throw new SignalingException(ErrorCode.IDENTITY_CONFLICT,
                    "connection is already identified as " + connection.getUserId());
        }
        connection.setUserId(userId);
        byUserId.computeIfAbsent(userId, k -> new LinkedHashSet<>()).add(connectionId);
    }

    public void setCurrentChannel(String connectionId, String channelId) {
        require(connectionId).setCurrentChannel(channelId);
    }

    /** The connection, provided it has joined a channel at least once. */
    public Connection requireIdentified(String connectionId) {
        Connection connection = require(connectionId);
        if (!connection.hasIdentity()) {
            throw new SignalingException(ErrorCode.IDENTITY_NOT_SET, "join a channel before sending this event");
        }
        return connection;
    }

    /** The connection, provided it is currently a member of {@code channelId}. */
    public Connection requireMember(String connectionId, String channelId) {
        Connection connection = requireIdentified(connectionId);
        if (!channelId.equals(connection.getCurrentChannel())) {
            throw new SignalingException(ErrorCode.NOT_IN_CHANNEL, "not a member of channel " + channelId);
        }
        return connection;
    }

    /**
     * Drops the record. Callers leave the current channel first.
     */
    public Optional<Connection> remove(String connectionId) {
        Connection removed = connections.remove(connectionId);
        if (removed == null) return Optional.empty();
        if (removed.hasIdentity()) {
            Set<String> ids = byUserId.get(removed.getUserId());
            if (ids != null) {
                ids.remove(connectionId);
                if (ids.isEmpty()) byUserId.remove(removed.getUserId());
            }
        }
        return Optional.of(removed);
    }

    public int size() {
        return connections.size();
    }

    /** Snapshot of live connection ids in registration order. */
    public List<String> connectionIds() {
        return new ArrayList<>(connections.keySet());
    }

    private Connection require(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            throw new IllegalArgumentException("unknown connection: " + connectionId);
        }
        return connection;
    }
}
