package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TransmissionMessage {
    @NotBlank
    public String channelId;

    public String userId;

    public Long timestamp;
}
