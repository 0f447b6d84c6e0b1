package com.walkierelay.server.model;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Payloads {

    private Payloads() {
    }

    /**
     * Ordered JSON object from alternating keys and values. Null values are kept.
     */
    public static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keys and values must pair up");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }

    public static Map<String, Object> error(String code, String message, String event) {
        return of("code", code, "message", message, "event", event);
    }
}
