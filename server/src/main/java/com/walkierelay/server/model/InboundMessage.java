package com.walkierelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope of every text frame: {@code {"event": "...", "data": ...}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessage {
    public String event;
    public JsonNode data;
}
