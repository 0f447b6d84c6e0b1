package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One piece of a streamed transmission. The sequence number is relayed verbatim.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AudioChunkMessage {
    @NotBlank
    public String channelId;

    @NotNull
    public JsonNode chunk;

    @NotNull
    public JsonNode sequence;
}
