package com.comments.capture.service;

/**
 * The envelope could not be handed to the bus. Nothing was written anywhere, so
 * the caller may simply resubmit.
 */
public class CaptureException extends RuntimeException {

    private final String requestId;

    public CaptureException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
