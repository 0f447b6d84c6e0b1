package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AudioDataMessage extends TransmissionMessage {
    @NotNull
    public JsonNode audioData;
}
