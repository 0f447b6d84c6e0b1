package com.walkierelay.server.support;

import com.walkierelay.server.dispatch.EventDispatcher;
import com.walkierelay.server.presence.PresenceBroadcaster;
import com.walkierelay.server.registry.ChannelDirectory;
import com.walkierelay.server.registry.ConnectionRegistry;
import com.walkierelay.server.relay.MediaRelay;
import com.walkierelay.server.signaling.SignalingRouter;

import java.time.Instant;

/**
 * A complete, independent relay core wired to a {@link RecordingTransport}.
 */
public class RelayFixture {
    public static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final RecordingTransport transport = new RecordingTransport();
    public final ConnectionRegistry connections = new ConnectionRegistry(clock);
    public final ChannelDirectory channels = new ChannelDirectory(clock);
    public final PresenceBroadcaster presence = new PresenceBroadcaster(connections, channels, transport);
    public final SignalingRouter router;
    public final MediaRelay relay = new MediaRelay(connections, channels, transport, clock);
    public final EventDispatcher dispatcher;

    public RelayFixture() {
        this(false);
    }

    public RelayFixture(boolean allowGlobalAddressing) {
        this.router = new SignalingRouter(connections, channels, transport, allowGlobalAddressing);
        this.dispatcher = new EventDispatcher(connections, presence, router, relay, transport, clock);
    }

    /** Registers a connection and joins it to a channel. */
    public void connectAndJoin(String connectionId, String channelId, String userId) {
        connections.register(connectionId);
        presence.join(connectionId, channelId, userId);
    }
}
