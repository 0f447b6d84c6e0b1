package com.walkierelay.server.model;

public class OutboundMessage {
    public final String event;
    public final Object data;

    public OutboundMessage(String event, Object data) {
        this.event = event;
        this.data = data;
    }
}
