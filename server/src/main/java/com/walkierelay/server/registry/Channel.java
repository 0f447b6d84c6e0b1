package com.walkierelay.server.registry;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A room and its members, keyed by connection id in join order.
 * Owned by {@link ChannelDirectory}.
 */
public class Channel {
    private final String channelId;
    private final Instant createdAt;
    private final Map<String, Member> members = new LinkedHashMap<>();
    private long messageCount;

    Channel(String channelId, Instant createdAt) {
        this.channelId = channelId;
        this.createdAt = createdAt;
    }

    public String getChannelId() { return channelId; }
    public Instant getCreatedAt() { return createdAt; }
    public long getMessageCount() { return messageCount; }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean hasMember(String connectionId) {
        return members.containsKey(connectionId);
    }

    public Collection<Member> getMembers() {
        return Collections.unmodifiableCollection(members.values());
    }

    /** First member (in join order) holding the given identity. */
    public Optional<Member> findMemberByUserId(String userId) {
        return members.values().stream()
                .filter(m -> m.getUserId().equals(userId))
                .findFirst();
    }

    public List<String> userIds() {
        return members.values().stream().map(Member::getUserId).toList();
    }

    public List<String> userIdsExcept(String connectionId) {
        return members.values().stream()
                .filter(m -> !m.getConnectionId().equals(connectionId))
                .map(Member::getUserId)
                .toList();
    }

    boolean add(Member member) {
        return members.putIfAbsent(member.getConnectionId(), member) == null;
    }

    boolean remove(String connectionId) {
        return members.remove(connectionId) != null;
    }

    void incrementMessageCount() {
        messageCount++;
    }
}
