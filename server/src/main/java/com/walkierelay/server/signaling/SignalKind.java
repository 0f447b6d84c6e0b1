package com.walkierelay.server.signaling;

import com.fasterxml.jackson.databind.JsonNode;
import com.walkierelay.server.model.SignalMessage;

/**
 * The three negotiation payloads and the field each travels in.
 */
public enum SignalKind {
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("candidate");

    private final String field;

    SignalKind(String field) {
        this.field = field;
    }

    public String field() {
        return field;
    }

    JsonNode payloadOf(SignalMessage message) {
        return switch (this) {
            case OFFER -> message.offer;
            case ANSWER -> message.answer;
            case ICE_CANDIDATE -> message.candidate;
        };
    }
}
