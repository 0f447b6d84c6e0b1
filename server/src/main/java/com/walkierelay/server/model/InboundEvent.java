package com.walkierelay.server.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Events a client may send.
 */
public enum InboundEvent {
    JOIN_CHANNEL("join-channel"),
    LEAVE_CHANNEL("leave-channel"),
    AUDIO_DATA("audio-data"),
    AUDIO_URL("audio-url"),
    AUDIO_CHUNK("audio-chunk"),
    TRANSMISSION_START("transmission-start"),
    TRANSMISSION_END("transmission-end"),
    WEBRTC_OFFER("webrtc-offer"),
    WEBRTC_ANSWER("webrtc-answer"),
    WEBRTC_ICE_CANDIDATE("webrtc-ice-candidate"),
    ICE_CANDIDATE("ice-candidate"),
    REQUEST_WEBRTC_CONNECTION("request-webrtc-connection"),
    GET_CHANNEL_USERS("get-channel-users"),
    PING("ping");

    private final String wireName;

    InboundEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<InboundEvent> fromWire(String name) {
        return Arrays.stream(values()).filter(e -> e.wireName.equals(name)).findFirst();
    }
}
