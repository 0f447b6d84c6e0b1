package com.walkierelay.server.relay;

import com.walkierelay.server.model.AudioChunkMessage;
import com.walkierelay.server.model.AudioDataMessage;
import com.walkierelay.server.model.AudioUrlMessage;
import com.walkierelay.server.model.OutboundEvent;
import com.walkierelay.server.model.Payloads;
import com.walkierelay.server.model.TransmissionMessage;
import com.walkierelay.server.registry.ChannelDirectory;
import com.walkierelay.server.registry.Connection;
import com.walkierelay.server.registry.ConnectionRegistry;
import com.walkierelay.server.ws.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Fire-and-forget fan-out of transmission state and audio to the rest of the sender's channel.
 * The outgoing {@code userId} is always the sender's registered identity.
 */
@Component
public class MediaRelay {
    private static final Logger log = LoggerFactory.getLogger(MediaRelay.class);

    private final ConnectionRegistry connections;
    private final ChannelDirectory channels;
    private final Transport transport;
    private final Clock clock;

    public MediaRelay(ConnectionRegistry connections, ChannelDirectory channels, Transport transport, Clock clock) {
        this.connections = connections;
        this.channels = channels;
        this.transport = transport;
        this.clock = clock;
    }

    public void transmissionStart(String connectionId, TransmissionMessage message) {
        Connection sender = connections.requireMember(connectionId, message.channelId);
        log.info("[RELAY] {} started transmission in {}", sender.getUserId(), message.channelId);
        fanOut(sender, message.channelId, OutboundEvent.TRANSMISSION_START,
                Payloads.of("userId", sender.getUserId(), "timestamp", timestamp(message.timestamp)));
    }

    public void transmissionEnd(String connectionId, TransmissionMessage message) {
        Connection sender = connections.requireMember(connectionId, message.channelId);
        log.info("[RELAY] {} ended transmission in {}", sender.getUserId(), message.channelId);
        fanOut(sender, message.channelId, OutboundEvent.TRANSMISSION_END,
                Payloads.of("userId", sender.getUserId(), "timestamp", timestamp(message.timestamp)));
    }

    public void audioData(String connectionId, AudioDataMessage message) {
        Connection sender = connections.requireMember(connectionId, message.channelId);
        log.info("[RELAY] {} sending audio to {} ({} chars)", sender.getUserId(), message.channelId,
                message.audioData.isTextual() ? message.audioData.asText().length() : message.audioData.size());
        fanOut(sender, message.channelId, OutboundEvent.AUDIO_RECEIVED,
                Payloads.of("userId", sender.getUserId(),
                        "audioData", message.audioData,
                        "timestamp", timestamp(message.timestamp)));
    }

    public void audioUrl(String connectionId, AudioUrlMessage message) {
        Connection sender = connections.requireMember(connectionId, message.channelId);
        log.info("[RELAY] {} sharing audio url in {}: {}", sender.getUserId(), message.channelId, message.audioUrl);
        fanOut(sender, message.channelId, OutboundEvent.AUDIO_MESSAGE,
                Payloads.of("userId", sender.getUserId(),
                        "audioUrl", message.audioUrl,
                        "timestamp", timestamp(message.timestamp)));
    }

    // high volume, not logged
    public void audioChunk(String connectionId, AudioChunkMessage message) {
        Connection sender = connections.requireMember(connectionId, message.channelId);
        fanOut(sender, message.channelId, OutboundEvent.AUDIO_CHUNK,
                Payloads.of("userId", sender.getUserId(),
                        "chunk", message.chunk,
                        "sequence", message.sequence,
                        "timestamp", clock.millis()));
    }

    /**
     * Announces a file stored by the upload endpoint to everyone in the channel.
     */
    public void announceUpload(String channelId, String userId, String audioUrl) {
        log.info("[UPLOAD] {} announced to channel={}", audioUrl, channelId);
        transport.broadcast(channelId, OutboundEvent.AUDIO_MESSAGE.wireName(),
                Payloads.of("userId", userId, "audioUrl", audioUrl, "timestamp", clock.millis()), null);
        channels.incrementMessageCount(channelId);
    }

    private void fanOut(Connection sender, String channelId, OutboundEvent event, Object payload) {
        transport.broadcast(channelId, event.wireName(), payload, sender.getConnectionId());
        channels.incrementMessageCount(channelId);
    }

    private long timestamp(Long clientTimestamp) {
        return clientTimestamp != null ? clientTimestamp : clock.millis();
    }
}
