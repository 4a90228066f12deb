package com.comments.processor.service;

/**
 * The envelope itself is unusable; redelivering it cannot succeed.
 */
public class PermanentProcessingException extends ProcessingException {

    public PermanentProcessingException(String requestId, String message) {
        super(requestId, message, null);
    }

    public PermanentProcessingException(String requestId, String message, Throwable cause) {
        super(requestId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
