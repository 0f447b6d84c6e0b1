package com.walkierelay.server.http;

/**
 * Client error on the upload endpoint; answered with 400.
 */
public class UploadRejectedException extends RuntimeException {
    public UploadRejectedException(String message) {
        super(message);
    }
}
