package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

/**
 * Payload of {@code leave-channel} and {@code get-channel-users}. A {@code userId} may be sent
 * but the connection's registered identity is used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChannelRequest {
    @NotBlank
    public String channelId;

    public String userId;
}
