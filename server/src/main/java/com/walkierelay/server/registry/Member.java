package com.walkierelay.server.registry;

import java.time.Instant;

public class Member {
    private final String connectionId;
    private final String userId;
    private final Instant joinedAt;

    Member(String connectionId, String userId, Instant joinedAt) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.joinedAt = joinedAt;
    }

    public String getConnectionId() { return connectionId; }
    public String getUserId() { return userId; }
    public Instant getJoinedAt() { return joinedAt; }
}
