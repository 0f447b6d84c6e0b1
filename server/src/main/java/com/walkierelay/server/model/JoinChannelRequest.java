package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public class JoinChannelRequest {
    @NotBlank
    public String channelId;

    @NotBlank
    public String userId;
}
