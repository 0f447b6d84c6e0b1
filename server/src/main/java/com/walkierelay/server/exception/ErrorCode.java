package com.walkierelay.server.exception;

/**
 * Codes carried in the {@code error} reply sent back to a connection whose event was rejected.
 */
public enum ErrorCode {
    MALFORMED_MESSAGE("malformed-message"),
    UNKNOWN_EVENT("unknown-event"),
    INVALID_PAYLOAD("invalid-payload"),
    IDENTITY_NOT_SET("identity-not-set"),
    IDENTITY_CONFLICT("identity-conflict"),
    NOT_IN_CHANNEL("not-in-channel");

    private final String wireCode;

    ErrorCode(String wireCode) {
        this.wireCode = wireCode;
    }

    public String wireCode() {
        return wireCode;
    }
}
