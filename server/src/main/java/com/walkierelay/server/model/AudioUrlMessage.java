package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AudioUrlMessage extends TransmissionMessage {
    @NotBlank
    public String audioUrl;
}
