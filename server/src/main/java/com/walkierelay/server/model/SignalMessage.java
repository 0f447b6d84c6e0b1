package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.AssertTrue;

/**
 * An offer, answer or ICE candidate. Addressed either inside a channel
 * ({@code channelId} plus optional {@code targetUserId}) or globally ({@code to}).
 * The negotiation payload itself is opaque.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignalMessage {
    public String channelId;
    public String userId;
    public String targetUserId;
    public String to;

    public JsonNode offer;
    public JsonNode answer;
    public JsonNode candidate;

    @JsonIgnore
    @AssertTrue(message = "either channelId or to is required")
    public boolean isAddressed() {
        return isPresent(channelId) || isPresent(to);
    }

    @JsonIgnore
    public boolean isGloballyAddressed() {
        return isPresent(to);
    }

    @JsonIgnore
    public boolean isTargeted() {
        return isPresent(targetUserId);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
