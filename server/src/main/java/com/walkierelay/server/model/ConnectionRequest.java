package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ConnectionRequest {
    @NotBlank
    public String channelId;

    public String userId;

    @NotBlank
    public String targetUserId;
}
