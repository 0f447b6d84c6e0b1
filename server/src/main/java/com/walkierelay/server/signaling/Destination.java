package com.walkierelay.server.signaling;

import java.util.Objects;

/**
 * Where a signal goes: the rest of a channel, or one identity. A direct destination is scoped to
 * a channel unless it was globally addressed, in which case {@link #getChannelId()} is null.
 */
public final class Destination {

    public enum Kind { BROADCAST, DIRECT }

    private final Kind kind;
    private final String channelId;
    private final String userId;

    private Destination(Kind kind, String channelId, String userId) {
        this.kind = kind;
        this.channelId = channelId;
        this.userId = userId;
    }

    public static Destination broadcast(String channelId) {
        return new Destination(Kind.BROADCAST, Objects.requireNonNull(channelId), null);
    }

    public static Destination direct(String userId, String channelScope) {
        return new Destination(Kind.DIRECT, channelScope, Objects.requireNonNull(userId));
    }

    public Kind getKind() { return kind; }
    public String getChannelId() { return channelId; }
    public String getUserId() { return userId; }

    public boolean isGlobal() {
        return kind == Kind.DIRECT && channelId == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Destination)) return false;
        Destination that = (Destination) o;
        return kind == that.kind && Objects.equals(channelId, that.channelId) && Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, channelId, userId);
    }

    @Override
    public String toString() {
        return kind == Kind.BROADCAST
                ? "broadcast(" + channelId + ")"
                : "direct(" + userId + (channelId == null ? ", global)" : ", " + channelId + ")");
    }
}
