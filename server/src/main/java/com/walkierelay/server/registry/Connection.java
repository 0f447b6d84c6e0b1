package com.walkierelay.server.registry;

import java.time.Instant;

/**
 * Session record for one live socket. Mutated only through {@link ConnectionRegistry}.
 */
public class Connection {
    private final String connectionId;
    private final Instant connectedAt;
    private String userId;
    private String currentChannel;

    Connection(String connectionId, Instant connectedAt) {
        this.connectionId = connectionId;
        this.connectedAt = connectedAt;
    }

    public String getConnectionId() { return connectionId; }
    public Instant getConnectedAt() { return connectedAt; }
    public String getUserId() { return userId; }
    public String getCurrentChannel() { return currentChannel; }

    public boolean hasIdentity() {
        return userId != null;
    }

    void setUserId(String userId) { this.userId = userId; }
    void setCurrentChannel(String currentChannel) { this.currentChannel = currentChannel; }

    @Override
    public String toString() {
        return "Connection{" + connectionId + ", userId=" + userId + ", channel=" + currentChannel + "}";
    }
}
