package com.walkierelay.server.model;

import com.walkierelay.server.registry.Channel;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a channel for the HTTP listing.
 */
public class ChannelView {
    public final String id;
    public final int userCount;
    public final List<MemberView> users;
    public final Instant createdAt;
    public final long messageCount;

    public ChannelView(String id, int userCount, List<MemberView> users, Instant createdAt, long messageCount) {
        this.id = id;
        this.userCount = userCount;
        this.users = users;
        this.createdAt = createdAt;
        this.messageCount = messageCount;
    }

    public static ChannelView of(Channel channel) {
        List<MemberView> users = channel.getMembers().stream()
                .map(m -> new MemberView(m.getUserId(), m.getJoinedAt()))
                .toList();
        return new ChannelView(channel.getChannelId(), users.size(), users,
                channel.getCreatedAt(), channel.getMessageCount());
    }

    public static class MemberView {
        public final String userId;
        public final Instant joinedAt;

        public MemberView(String userId, Instant joinedAt) {
            this.userId = userId;
            this.joinedAt = joinedAt;
        }
    }
}
