package com.walkierelay.server.exception;

/**
 * Thrown when an inbound event cannot be applied. The dispatcher turns it into an
 * {@code error} reply to the sender; it never closes the connection.
 */
public class SignalingException extends RuntimeException {
    private final ErrorCode code;

    public SignalingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
