package com.walkierelay.server.model;

/**
 * Events the server emits. Signaling relays echo the inbound event name instead.
 */
public enum OutboundEvent {
    CONNECTED("connected"),
    CHANNEL_USERS("channel-users"),
    USER_JOINED("user-joined"),
    USER_LEFT("user-left"),
    AUDIO_RECEIVED("audio-received"),
    AUDIO_MESSAGE("audio-message"),
    AUDIO_CHUNK("audio-chunk"),
    TRANSMISSION_START("transmission-start"),
    TRANSMISSION_END("transmission-end"),
    PONG("pong"),
    WEBRTC_CONNECTION_REQUEST("webrtc-connection-request"),
    SERVER_SHUTDOWN("server-shutdown"),
    ERROR("error");

    private final String wireName;

    OutboundEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
