package com.walkierelay.server.registry;

import com.walkierelay.server.model.ChannelView;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every {@link Channel}. A channel exists only while it has members: it is created on the
 * first join and deleted as soon as its last member is removed.
 * <p>
 * Not thread-safe: only the event loop touches it.
 */
@Component
public class ChannelDirectory {

    private final Map<String, Channel> channels = new LinkedHashMap<>();
    private final Clock clock;

    public ChannelDirectory(Clock clock) {
        this.clock = clock;
    }

    public Channel getOrCreate(String channelId) {
        return channels.computeIfAbsent(channelId, id -> new Channel(id, clock.instant()));
    }

    public Optional<Channel> find(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    /** @return true if the connection was not a member yet */
    public boolean addMember(String channelId, String connectionId, String userId) {
        return getOrCreate(channelId).add(new Member(connectionId, userId, clock.instant()));
    }

    /**
     * Removes the member and deletes the channel if it is left empty.
     *
     * @return members remaining, 0 for an unknown channel
     */
    public int removeMember(String channelId, String connectionId) {
        Channel channel = channels.get(channelId);
        if (channel == null) return 0;
        channel.remove(connectionId);
        if (channel.isEmpty()) {
            channels.remove(channelId);
            return 0;
        }
        return channel.size();
    }

    public List<String> listMembers(String channelId) {
        Channel channel = channels.get(channelId);
        return channel == null ? List.of() : channel.userIds();
    }

    public void incrementMessageCount(String channelId) {
        Channel channel = channels.get(channelId);
        if (channel != null) channel.incrementMessageCount();
    }

    /**
     * Deletes channels left without members. Safe to run at any time.
     *
     * @return how many channels were deleted
     */
    public int sweepEmpty() {
        int cleaned = 0;
        Iterator<Channel> it = channels.values().iterator();
        while (it.hasNext()) {
            if (it.next().isEmpty()) {
                it.remove();
                cleaned++;
            }
        }
        return cleaned;
    }

    public List<ChannelView> snapshot() {
        return channels.values().stream().map(ChannelView::of).toList();
    }

    public int size() {
        return channels.size();
    }

    public long totalMessageCount() {
        return channels.values().stream().mapToLong(Channel::getMessageCount).sum();
    }
}
