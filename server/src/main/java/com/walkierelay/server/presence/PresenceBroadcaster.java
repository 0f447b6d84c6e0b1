package com.walkierelay.server.presence;

import com.walkierelay.server.model.OutboundEvent;
import com.walkierelay.server.registry.ChannelDirectory;
import com.walkierelay.server.registry.Connection;
import com.walkierelay.server.registry.ConnectionRegistry;
import com.walkierelay.server.ws.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Join and leave: keeps the registry, the directory and the transport rooms consistent and
 * tells the rest of the channel.
 * <p>
 * A joiner always gets its {@code channel-users} snapshot before any later
 * {@code user-joined} for that channel.
 */
@Component
public class PresenceBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(PresenceBroadcaster.class);

    private final ConnectionRegistry connections;
    private final ChannelDirectory channels;
    private final Transport transport;

    public PresenceBroadcaster(ConnectionRegistry connections, ChannelDirectory channels, Transport transport) {
        this.connections = connections;
        this.channels = channels;
        this.transport = transport;
    }

    public void join(String connectionId, String channelId, String userId) {
        Connection connection = connections.lookup(connectionId)
                .orElseThrow(() -> new IllegalArgumentException("unknown connection: " + connectionId));
        connections.setIdentity(connectionId, userId);

        // one channel at a time
        String previous = connection.getCurrentChannel();
        if (previous != null && !previous.equals(channelId)) {
            depart(connection, previous);
        }

        boolean added = channels.addMember(channelId, connectionId, userId);
        connections.setCurrentChannel(connectionId, channelId);
        transport.join(connectionId, channelId);

        List<String> others = channels.find(channelId)
                .map(c -> c.userIdsExcept(connectionId))
                .orElse(List.of());
        transport.send(connectionId, OutboundEvent.CHANNEL_USERS.wireName(), others);

        if (added) {
            transport.broadcast(channelId, OutboundEvent.USER_JOINED.wireName(), userId, connectionId);
        }
        log.info("[JOIN] {} joined channel={} total={}", userId, channelId, others.size() + 1);
    }

    /** No-op unless the connection is currently a member of {@code channelId}. */
    public void leave(String connectionId, String channelId) {
        Optional<Connection> connection = connections.lookup(connectionId);
        if (connection.isEmpty() || !isMember(connectionId, channelId)) {
            log.debug("[LEAVE] ignored: {} is not in channel={}", connectionId, channelId);
            return;
        }
        depart(connection.get(), channelId);
        connections.setCurrentChannel(connectionId, null);
    }

    /** Implicit leave followed by removal from the registry. Repeating it is a no-op. */
    public void disconnect(String connectionId) {
        Optional<Connection> connection = connections.lookup(connectionId);
        if (connection.isEmpty()) return;
        String channelId = connection.get().getCurrentChannel();
        if (channelId != null && isMember(connectionId, channelId)) {
            depart(connection.get(), channelId);
        }
        connections.remove(connectionId);
        log.info("[DISCONNECT] {} userId={} connections={}",
                connectionId, connection.get().getUserId(), connections.size());
    }

    public void channelUsers(String connectionId, String channelId) {
        transport.send(connectionId, OutboundEvent.CHANNEL_USERS.wireName(), channels.listMembers(channelId));
    }

    private void depart(Connection connection, String channelId) {
        String connectionId = connection.getConnectionId();
        int remaining = channels.removeMember(channelId, connectionId);
        transport.leave(connectionId, channelId);
        transport.broadcast(channelId, OutboundEvent.USER_LEFT.wireName(), connection.getUserId(), connectionId);
        log.info("[LEAVE] {} left channel={} remaining={}", connection.getUserId(), channelId, remaining);
        if (remaining == 0) {
            log.info("[LEAVE] channel={} deleted (empty)", channelId);
        }
    }

    private boolean isMember(String connectionId, String channelId) {
        return channels.find(channelId).map(c -> c.hasMember(connectionId)).orElse(false);
    }
}
